package com.storylens.highlight;

import com.storylens.models.Entity;
import com.storylens.models.EntityType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HighlightApplierTest {

    private static final String TEXT = "Aria met Bran near the Crystal Tower.";

    private final EntityIndex index = EntityIndex.build(List.of(
        new Entity("aria", "Aria", EntityType.CHARACTER),
        new Entity("bran", "Bran", EntityType.CHARACTER),
        new Entity("tower", "Crystal Tower", EntityType.LOCATION)));

    private final HighlightApplier applier = new HighlightApplier();

    private static ResolvedMatch match(String entityId, int start, int end) {
        return new ResolvedMatch(0, entityId, PatternKind.NAME, start, end);
    }

    private ScanRequest request(String text, long revision) {
        return new ScanRequest("doc", ScanWindow.whole(text), text, revision, index);
    }

    @Test
    void appliesOnlyTheDifference() {
        HighlightState state = new HighlightState("doc");
        FakeDocument document = new FakeDocument(TEXT);
        RecordingTarget target = new RecordingTarget();

        ResolvedMatch aria = match("aria", 0, 4);
        ResolvedMatch bran = match("bran", 9, 13);
        ResolvedMatch tower = match("tower", 23, 36);

        applier.reconcile(state, request(TEXT, 0), List.of(aria, bran), document, target);
        assertEquals(List.of("+aria@0", "+bran@9"), target.calls);
        assertEquals(1, state.getRevision());

        target.calls.clear();
        ApplyOutcome outcome = applier.reconcile(state, request(TEXT, 1), List.of(bran, tower), document, target);

        assertEquals(List.of("-0", "+tower@23"), target.calls);
        assertEquals(1, outcome.getMarked());
        assertEquals(1, outcome.getUnmarked());
        assertEquals(1, outcome.getUnchanged());
        assertEquals(List.of(bran, tower), state.getActiveMatches());
        assertEquals(2, state.getRevision());
    }

    @Test
    void identicalResultTouchesNothing() {
        HighlightState state = new HighlightState("doc");
        FakeDocument document = new FakeDocument(TEXT);
        RecordingTarget target = new RecordingTarget();
        List<ResolvedMatch> matches = List.of(match("aria", 0, 4));

        applier.reconcile(state, request(TEXT, 0), matches, document, target);
        target.calls.clear();
        applier.reconcile(state, request(TEXT, 1), matches, document, target);

        assertTrue(target.calls.isEmpty());
    }

    @Test
    void changedTextAbortsWithoutTouchingMarks() {
        HighlightState state = new HighlightState("doc");
        FakeDocument document = new FakeDocument(TEXT);
        RecordingTarget target = new RecordingTarget();
        ScanRequest stale = request(TEXT, 0);

        document.text = "Bran met Aria near the Crystal Tower.";

        assertThrows(StaleApplyException.class,
            () -> applier.reconcile(state, stale, List.of(match("aria", 0, 4)), document, target));
        assertTrue(target.calls.isEmpty());
        assertTrue(state.getActiveMatches().isEmpty());
        assertEquals(0, state.getRevision());
    }

    @Test
    void rejectedMarkRollsBackTheBatch() {
        HighlightState state = new HighlightState("doc");
        FakeDocument document = new FakeDocument(TEXT);
        RecordingTarget target = new RecordingTarget();
        ResolvedMatch aria = match("aria", 0, 4);
        applier.reconcile(state, request(TEXT, 0), List.of(aria), document, target);
        target.calls.clear();

        target.rejectEntity = "tower";
        List<ResolvedMatch> next = List.of(match("bran", 9, 13), match("tower", 23, 36));

        assertThrows(StaleApplyException.class,
            () -> applier.reconcile(state, request(TEXT, 1), next, document, target));

        assertEquals(List.of("-0", "+bran@9", "-9", "+aria@0"), target.calls);
        assertEquals(List.of(aria), state.getActiveMatches());
        assertEquals(1, state.getRevision());
    }

    @Test
    void clearRemovesEveryActiveMark() {
        HighlightState state = new HighlightState("doc");
        FakeDocument document = new FakeDocument(TEXT);
        RecordingTarget target = new RecordingTarget();
        applier.reconcile(state, request(TEXT, 0),
            List.of(match("aria", 0, 4), match("bran", 9, 13)), document, target);
        target.calls.clear();

        int removed = applier.clear(state, document, target);

        assertEquals(2, removed);
        assertEquals(List.of("-0", "-9"), target.calls);
        assertTrue(state.getActiveMatches().isEmpty());
    }

    static class FakeDocument implements DocumentModel {
        String text;

        FakeDocument(String text) {
            this.text = text;
        }

        @Override
        public String getText() {
            return text;
        }

        @Override
        public int getCursorOffset() {
            return 0;
        }

        @Override
        public int getWordCount() {
            return text.split("\\s+").length;
        }

        @Override
        public void addChangeListener(DocumentChangeListener listener) {
        }

        @Override
        public void removeChangeListener(DocumentChangeListener listener) {
        }
    }

    static class RecordingTarget implements MarkTarget {
        final List<String> calls = new ArrayList<>();
        String rejectEntity;

        @Override
        public void applyMark(int start, int end, String entityId) {
            if (entityId.equals(rejectEntity)) {
                throw new IllegalStateException("rejected " + entityId);
            }
            calls.add("+" + entityId + "@" + start);
        }

        @Override
        public void removeMark(int start, int end) {
            calls.add("-" + start);
        }
    }
}
