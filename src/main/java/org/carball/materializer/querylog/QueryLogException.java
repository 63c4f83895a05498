package org.carball.materializer.querylog;

public class QueryLogException extends Exception {

    public QueryLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
