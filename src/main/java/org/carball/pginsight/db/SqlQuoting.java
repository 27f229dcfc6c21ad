package org.carball.pginsight.db;

/**
 * Identifier and literal quoting for the few values interpolated into catalog queries.
 */
public final class SqlQuoting {

    private SqlQuoting() {
    }

    public static String quoteIdent(String identifier) {
        return "\"" + identifier.replace("\"", "\"\"") + "\"";
    }

    public static String quoteLiteral(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
