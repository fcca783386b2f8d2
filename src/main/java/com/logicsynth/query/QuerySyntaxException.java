package com.logicsynth.query;

/**
 * The query text is not a single goal atom.
 */
public class QuerySyntaxException extends RuntimeException {

    public QuerySyntaxException(String query, String detail) {
        super("invalid query '" + query + "': " + detail);
    }
}
