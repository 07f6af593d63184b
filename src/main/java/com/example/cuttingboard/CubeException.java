package com.example.cuttingboard;

/**
 * Base class of the errors raised by the cube engine.
 *
 * <p>All the errors are unchecked and local to a single query evaluation:
 * none of them leaves the board in an unusable state.
 */
public class CubeException extends RuntimeException {

    public CubeException(String message) {
        super(message);
    }

    public CubeException(String message, Throwable cause) {
        super(message, cause);
    }
}
