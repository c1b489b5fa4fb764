package com.storylens.highlight;

/**
 * Thrown when a scan runs past its time budget. The caller retries on a smaller window.
 */
public class ScanBudgetExceededException extends RuntimeException {
    private final int scannedChars;

    public ScanBudgetExceededException(String message, int scannedChars) {
        super(message);
        this.scannedChars = scannedChars;
    }

    public int getScannedChars() {
        return scannedChars;
    }
}
