package com.storylens.highlight;

/**
 * Half-open document range selected for one scan.
 */
public final class ScanWindow {
    private final int start;
    private final int end;
    private final boolean degraded;

    public ScanWindow(int start, int end, boolean degraded) {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid window [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
        this.degraded = degraded;
    }

    public static ScanWindow whole(CharSequence text) {
        return new ScanWindow(0, text != null ? text.length() : 0, false);
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int length() {
        return end - start;
    }

    /**
     * True when the window was shrunk below the normal size to stay within the scan budget.
     */
    public boolean isDegraded() {
        return degraded;
    }

    public boolean contains(int offset) {
        return offset >= start && offset <= end;
    }

    public ScanWindow asDegraded() {
        return degraded ? this : new ScanWindow(start, end, true);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ScanWindow)) return false;
        ScanWindow that = (ScanWindow) o;
        return start == that.start && end == that.end && degraded == that.degraded;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * start + end) + (degraded ? 1 : 0);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")" + (degraded ? " degraded" : "");
    }
}
