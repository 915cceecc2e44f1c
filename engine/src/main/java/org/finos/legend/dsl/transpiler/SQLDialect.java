package org.finos.legend.dsl.transpiler;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Interface defining SQL dialect-specific behavior.
 * Implementations handle differences between database engines.
 */
public interface SQLDialect {

    DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    DateTimeFormatter FRACTION_FORMAT = DateTimeFormatter.ofPattern(".SSSSSS");

    /**
     * @return The dialect name (e.g., "ANSI", "DuckDB")
     */
    String name();

    /**
     * Quote an identifier (table name, column name, alias).
     *
     * @param identifier The identifier to quote
     * @return The quoted identifier
     */
    String quoteIdentifier(String identifier);

    /**
     * Quote a string literal value.
     *
     * @param value The string value to quote
     * @return The quoted string literal
     */
    String quoteStringLiteral(String value);

    /**
     * Format a boolean literal.
     *
     * @param value The boolean value
     * @return The SQL boolean representation
     */
    String formatBoolean(boolean value);

    /**
     * Format a NULL literal.
     *
     * @return The SQL NULL representation
     */
    default String formatNull() {
        return "NULL";
    }

    /**
     * Format a DATE literal (e.g., "DATE '2024-01-15'").
     */
    default String formatDate(LocalDate date) {
        return "DATE '" + DATE_FORMAT.format(date) + "'";
    }

    /**
     * Format a TIMESTAMP literal, with a microsecond fraction only when the
     * timestamp has one (e.g., "TIMESTAMP '2024-01-15 10:30:00'" or
     * "TIMESTAMP '2024-01-15 10:30:00.250000'").
     */
    default String formatTimestamp(LocalDateTime timestamp) {
        String fraction = timestamp.getNano() != 0 ? FRACTION_FORMAT.format(timestamp) : "";
        return "TIMESTAMP '" + TIMESTAMP_FORMAT.format(timestamp) + fraction + "'";
    }

    /**
     * Format the row limiting clause.
     *
     * @param count  Maximum number of rows
     * @param offset Number of rows to skip (zero for none)
     * @return The clause in the {@code LIMIT [offset, ]count} form
     */
    default String formatLimit(int count, int offset) {
        return offset > 0 ? "LIMIT " + offset + ", " + count : "LIMIT " + count;
    }
}
