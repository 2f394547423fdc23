package com.markrunner.core.manifest;

/**
 * The input collection of a stage could not be read or planned. Raised before any unit runs.
 */
public class InputCollectionException extends RuntimeException {

    public InputCollectionException(String message) {
        super(message);
    }

    public InputCollectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
