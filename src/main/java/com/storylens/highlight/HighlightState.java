package com.storylens.highlight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Live highlight state of one document. Written only by {@link HighlightApplier} and the
 * owning {@link DocumentHighlighter} on the scheduler thread; readable from any thread.
 */
public final class HighlightState {
    private final String documentId;
    private volatile List<ResolvedMatch> activeMatches = List.of();
    private volatile long revision;

    public HighlightState(String documentId) {
        this.documentId = documentId;
    }

    public String getDocumentId() {
        return documentId;
    }

    /**
     * Active matches in document order.
     */
    public List<ResolvedMatch> getActiveMatches() {
        return activeMatches;
    }

    public int getActiveMatchCount() {
        return activeMatches.size();
    }

    public long getRevision() {
        return revision;
    }

    long bumpRevision() {
        return ++revision;
    }

    /**
     * Replaces the active set and advances the revision in one step.
     */
    void commit(List<ResolvedMatch> matches) {
        List<ResolvedMatch> sorted = new ArrayList<>(matches);
        Collections.sort(sorted);
        activeMatches = Collections.unmodifiableList(sorted);
        revision++;
    }
}
