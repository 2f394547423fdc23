package com.markrunner.engine;

/**
 * Infrastructure problem detected before any unit is dispatched (missing manifest,
 * unwritable log directory, bad concurrency). Never retried.
 */
public class BatchConfigurationException extends RuntimeException {

    public BatchConfigurationException(String message) {
        super(message);
    }

    public BatchConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
