package com.storylens.highlight;

/**
 * Write side of the editor: story reference marks. Marks live in their own namespace
 * ({@link #MARK_NAME}) and never touch user formatting such as bold or italic.
 *
 * Both operations are idempotent. Implementations throw {@link StaleApplyException} when
 * offsets no longer fit the document.
 */
public interface MarkTarget {

    String MARK_NAME = "story-reference";

    void applyMark(int start, int end, String entityId);

    void removeMark(int start, int end);
}
