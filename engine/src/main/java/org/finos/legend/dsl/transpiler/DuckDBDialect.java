package org.finos.legend.dsl.transpiler;

/**
 * SQL dialect implementation for DuckDB.
 * Same quoting as {@link AnsiDialect}, but the offset goes to a separate OFFSET clause.
 */
public final class DuckDBDialect implements SQLDialect {

    public static final DuckDBDialect INSTANCE = new DuckDBDialect();

    private DuckDBDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "DuckDB";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        return AnsiDialect.INSTANCE.quoteIdentifier(identifier);
    }

    @Override
    public String quoteStringLiteral(String value) {
        return AnsiDialect.INSTANCE.quoteStringLiteral(value);
    }

    @Override
    public String formatBoolean(boolean value) {
        return AnsiDialect.INSTANCE.formatBoolean(value);
    }

    @Override
    public String formatLimit(int count, int offset) {
        return offset > 0 ? "LIMIT " + count + " OFFSET " + offset : "LIMIT " + count;
    }
}
