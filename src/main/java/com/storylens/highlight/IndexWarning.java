package com.storylens.highlight;

import java.util.Objects;

/**
 * A catalog entry (or part of one) that was skipped while building the index.
 */
public final class IndexWarning {
    public enum Reason {
        MISSING_ENTITY,
        MISSING_ID,
        BLANK_NAME,
        DUPLICATE_ID,
        NAME_TOO_LONG,
        TAG_TOO_LONG,
        TOO_MANY_TAGS
    }

    private final String entityId;
    private final Reason reason;
    private final String detail;

    public IndexWarning(String entityId, Reason reason, String detail) {
        this.entityId = entityId;
        this.reason = Objects.requireNonNull(reason, "reason");
        this.detail = detail;
    }

    public String getEntityId() {
        return entityId;
    }

    public Reason getReason() {
        return reason;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IndexWarning)) return false;
        IndexWarning that = (IndexWarning) o;
        return Objects.equals(entityId, that.entityId)
            && reason == that.reason
            && Objects.equals(detail, that.detail);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, reason, detail);
    }

    @Override
    public String toString() {
        return reason + "(" + (entityId != null ? entityId : "?") + (detail != null ? ": " + detail : "") + ")";
    }
}
