package org.carball.pginsight.exception;

import lombok.Getter;

/**
 * A single SQL statement against the target server failed, timed out, or was refused
 * because the run deadline had already passed.
 */
@Getter
public class QueryFailedException extends Exception {

    private static final int QUERY_MAX_LENGTH = 100;

    private final String query;

    public QueryFailedException(String query, Throwable cause) {
        super(buildMessage(truncate(query), cause == null ? "unknown error" : cause.getMessage()), cause);
        this.query = truncate(query);
    }

    public QueryFailedException(String query, String reason) {
        super(buildMessage(truncate(query), reason));
        this.query = truncate(query);
    }

    private static String buildMessage(String query, String reason) {
        return String.format("query failed [%s]: %s", query, reason);
    }

    static String truncate(String query) {
        if (query == null) {
            return "";
        }
        String flattened = query.replaceAll("\\s+", " ").trim();
        return flattened.length() > QUERY_MAX_LENGTH
                ? flattened.substring(0, QUERY_MAX_LENGTH) + "..."
                : flattened;
    }
}
