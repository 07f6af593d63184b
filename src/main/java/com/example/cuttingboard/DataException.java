package com.example.cuttingboard;

/**
 * Some problem in the data definition, e.g. a label not defined in the cube.
 */
public class DataException extends CubeException {

    public DataException(String message) {
        super(message);
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
    }
}
