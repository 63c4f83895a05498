package org.carball.materializer.parser;

/**
 * Raised when a logged query cannot be parsed. Callers count and skip the record.
 */
public class QueryParseException extends Exception {

    private final String queryId;

    public QueryParseException(String queryId, String message, Throwable cause) {
        super(message, cause);
        this.queryId = queryId;
    }

    public String getQueryId() {
        return queryId;
    }
}
