package com.storylens.highlight;

/**
 * The document changed underneath a scan result, so its offsets can no longer be trusted.
 * The batch is dropped and a fresh scan scheduled.
 */
public class StaleApplyException extends RuntimeException {

    public StaleApplyException(String message) {
        super(message);
    }

    public StaleApplyException(String message, Throwable cause) {
        super(message, cause);
    }
}
