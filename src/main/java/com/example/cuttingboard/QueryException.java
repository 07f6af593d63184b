package com.example.cuttingboard;

/**
 * Some problem in the query definition, e.g. an unknown filter operator.
 */
public class QueryException extends CubeException {

    public QueryException(String message) {
        super(message);
    }
}
