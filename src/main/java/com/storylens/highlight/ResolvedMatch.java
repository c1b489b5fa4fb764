package com.storylens.highlight;

import java.util.Objects;

/**
 * A match that survived overlap resolution, positioned in document coordinates.
 * Two resolved matches are the same highlight when span and entity agree; the pattern
 * that produced them does not matter to the editor.
 */
public final class ResolvedMatch implements Comparable<ResolvedMatch> {
    private final int patternId;
    private final String entityId;
    private final PatternKind kind;
    private final int start;
    private final int end;

    public ResolvedMatch(int patternId, String entityId, PatternKind kind, int start, int end) {
        if (start < 0 || end <= start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
        this.patternId = patternId;
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.start = start;
        this.end = end;
    }

    static ResolvedMatch from(RawMatch raw, SearchPattern pattern, int windowStart) {
        return new ResolvedMatch(pattern.getId(), pattern.getSourceEntityId(), pattern.getKind(),
            windowStart + raw.getStart(), windowStart + raw.getEnd());
    }

    public int getPatternId() {
        return patternId;
    }

    public String getEntityId() {
        return entityId;
    }

    public PatternKind getKind() {
        return kind;
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

    public boolean overlaps(ResolvedMatch other) {
        return start < other.end && other.start < end;
    }

    @Override
    public int compareTo(ResolvedMatch o) {
        if (start != o.start) return Integer.compare(start, o.start);
        if (end != o.end) return Integer.compare(end, o.end);
        return entityId.compareTo(o.entityId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedMatch)) return false;
        ResolvedMatch that = (ResolvedMatch) o;
        return start == that.start && end == that.end && entityId.equals(that.entityId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end, entityId);
    }

    @Override
    public String toString() {
        return "ResolvedMatch{" + entityId + " " + kind + " [" + start + ", " + end + ")}";
    }
}
