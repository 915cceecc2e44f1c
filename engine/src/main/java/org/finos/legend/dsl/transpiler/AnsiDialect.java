package org.finos.legend.dsl.transpiler;

/**
 * Reference SQL dialect.
 * Double quotes for identifiers and single quotes for strings.
 */
public final class AnsiDialect implements SQLDialect {

    public static final AnsiDialect INSTANCE = new AnsiDialect();

    private AnsiDialect() {
        // Singleton
    }

    @Override
    public String name() {
        return "ANSI";
    }

    @Override
    public String quoteIdentifier(String identifier) {
        // Escape any existing double quotes by doubling them
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    @Override
    public String quoteStringLiteral(String value) {
        // Escape any existing single quotes by doubling them
        return "'" + value.replace("'", "''") + "'";
    }

    @Override
    public String formatBoolean(boolean value) {
        return value ? "TRUE" : "FALSE";
    }
}
