package com.storylens.highlight;

/**
 * A pattern occurrence inside a scan window, before overlap resolution.
 * Offsets are window-relative and half-open.
 */
public final class RawMatch {
    private final int patternId;
    private final int start;
    private final int end;

    public RawMatch(int patternId, int start, int end) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.patternId = patternId;
        this.start = start;
        this.end = end;
    }

    public int getPatternId() {
        return patternId;
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

    public boolean overlaps(RawMatch other) {
        return start < other.end && other.start < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawMatch)) return false;
        RawMatch that = (RawMatch) o;
        return patternId == that.patternId && start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * patternId + start) + end;
    }

    @Override
    public String toString() {
        return "RawMatch{p" + patternId + " [" + start + ", " + end + ")}";
    }
}
