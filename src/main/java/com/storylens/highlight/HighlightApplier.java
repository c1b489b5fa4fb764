package com.storylens.highlight;

import com.storylens.AppLogger;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reconciles a resolved match set against the marks currently in the editor.
 *
 * Only the difference is sent to the editor: spans that disappeared are unmarked, new spans
 * are marked, spans present in both are left alone so selection and undo history are not
 * disturbed on every keystroke. A batch is either applied completely or not at all.
 */
public class HighlightApplier {

    private final AppLogger logger = AppLogger.get();

    /**
     * @throws StaleApplyException when the document no longer holds the scanned text, a span
     *         does not fit the current text, or the mark target rejects an offset. Nothing is
     *         left half-applied in that case and {@code state} is unchanged.
     */
    public ApplyOutcome reconcile(HighlightState state, ScanRequest request, List<ResolvedMatch> next,
                                  DocumentModel document, MarkTarget target) {
        String text = document.getText();
        if (text == null) {
            text = "";
        }
        verifyWindow(request, text);

        Set<ResolvedMatch> previous = new LinkedHashSet<>(state.getActiveMatches());
        Set<ResolvedMatch> incoming = new LinkedHashSet<>(next);

        List<ResolvedMatch> toRemove = new ArrayList<>();
        for (ResolvedMatch match : previous) {
            if (!incoming.contains(match)) {
                toRemove.add(match);
            }
        }
        List<ResolvedMatch> toAdd = new ArrayList<>();
        for (ResolvedMatch match : incoming) {
            if (match.getEnd() > text.length()) {
                throw new StaleApplyException("Span " + match + " exceeds document length " + text.length());
            }
            if (!previous.contains(match)) {
                toAdd.add(match);
            }
        }

        List<ResolvedMatch> removed = new ArrayList<>();
        List<ResolvedMatch> added = new ArrayList<>();
        try {
            for (ResolvedMatch match : toRemove) {
                int end = Math.min(match.getEnd(), text.length());
                if (match.getStart() < end) {
                    target.removeMark(match.getStart(), end);
                }
                removed.add(match);
            }
            for (ResolvedMatch match : toAdd) {
                target.applyMark(match.getStart(), match.getEnd(), match.getEntityId());
                added.add(match);
            }
        } catch (RuntimeException e) {
            rollback(target, removed, added, text.length());
            if (e instanceof StaleApplyException) {
                throw e;
            }
            throw new StaleApplyException("Mark target rejected batch: " + e.getMessage(), e);
        }

        state.commit(next);
        return new ApplyOutcome(toAdd.size(), toRemove.size(), incoming.size() - toAdd.size());
    }

    /**
     * Removes every mark the state knows about, e.g. when highlighting is paused.
     */
    public int clear(HighlightState state, DocumentModel document, MarkTarget target) {
        List<ResolvedMatch> active = state.getActiveMatches();
        String text = document.getText();
        int length = text != null ? text.length() : 0;
        int removed = 0;
        for (ResolvedMatch match : active) {
            int end = Math.min(match.getEnd(), length);
            if (match.getStart() >= end) {
                continue;
            }
            try {
                target.removeMark(match.getStart(), end);
                removed++;
            } catch (RuntimeException e) {
                logWarning("Could not remove mark " + match + ": " + e.getMessage());
            }
        }
        state.commit(List.of());
        return removed;
    }

    private void verifyWindow(ScanRequest request, String text) {
        if (request.getWindowEnd() > text.length()) {
            throw new StaleApplyException("Window [" + request.getWindowStart() + ", " + request.getWindowEnd()
                + ") no longer fits document of length " + text.length());
        }
        if (!text.regionMatches(request.getWindowStart(), request.getText(), 0, request.getText().length())) {
            throw new StaleApplyException("Document text changed under " + request);
        }
    }

    private void rollback(MarkTarget target, List<ResolvedMatch> removed, List<ResolvedMatch> added, int length) {
        for (int i = added.size() - 1; i >= 0; i--) {
            ResolvedMatch match = added.get(i);
            try {
                target.removeMark(match.getStart(), match.getEnd());
            } catch (RuntimeException e) {
                logWarning("Rollback could not remove " + match + ": " + e.getMessage());
            }
        }
        for (int i = removed.size() - 1; i >= 0; i--) {
            ResolvedMatch match = removed.get(i);
            if (match.getEnd() > length) {
                continue;
            }
            try {
                target.applyMark(match.getStart(), match.getEnd(), match.getEntityId());
            } catch (RuntimeException e) {
                logWarning("Rollback could not restore " + match + ": " + e.getMessage());
            }
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[HighlightApplier] " + message);
        }
    }
}
