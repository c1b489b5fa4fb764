package com.storylens.highlight;

import java.util.Objects;

/**
 * A normalized search key derived from an entity's display name or one of its tags.
 */
public final class SearchPattern {
    private final int id;
    private final String text;
    private final String sourceEntityId;
    private final PatternKind kind;

    public SearchPattern(int id, String text, String sourceEntityId, PatternKind kind) {
        this.id = id;
        this.text = Objects.requireNonNull(text, "text");
        this.sourceEntityId = Objects.requireNonNull(sourceEntityId, "sourceEntityId");
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public int getId() {
        return id;
    }

    /**
     * Lower-cased text with whitespace runs collapsed to a single space.
     */
    public String getText() {
        return text;
    }

    public String getSourceEntityId() {
        return sourceEntityId;
    }

    public PatternKind getKind() {
        return kind;
    }

    public int length() {
        return text.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SearchPattern)) return false;
        SearchPattern that = (SearchPattern) o;
        return id == that.id
            && text.equals(that.text)
            && sourceEntityId.equals(that.sourceEntityId)
            && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, text, sourceEntityId, kind);
    }

    @Override
    public String toString() {
        return "SearchPattern{" + id + ", '" + text + "', " + kind + " -> " + sourceEntityId + "}";
    }
}
