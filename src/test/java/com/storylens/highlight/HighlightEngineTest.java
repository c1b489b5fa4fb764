package com.storylens.highlight;

import com.storylens.TextDocument;
import com.storylens.models.Entity;
import com.storylens.models.EntityType;
import com.storylens.models.HighlightConfig;
import com.storylens.models.StoryMark;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class HighlightEngineTest {

    private HighlightEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private static HighlightConfig fastConfig() {
        HighlightConfig config = HighlightConfig.defaults();
        config.setDebounceMs(5);
        return config;
    }

    private static Entity entity(String id, String name, String... tags) {
        Entity entity = new Entity(id, name, EntityType.CHARACTER);
        entity.setTags(List.of(tags));
        return entity;
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not met within 5s");
            }
            Thread.sleep(5);
        }
    }

    private static List<String> markedText(TextDocument document) {
        List<String> texts = new ArrayList<>();
        for (StoryMark mark : document.getMarks()) {
            texts.add(document.getText().substring(mark.getStart(), mark.getEnd()) + "=" + mark.getEntityId());
        }
        return texts;
    }

    @Test
    void highlightsLongestNamesAndTags() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(
            entity("aria", "Aria"),
            entity("aria-full", "Aria Blackwood", "scholar"));
        engine = new HighlightEngine(catalog, fastConfig());
        TextDocument document = new TextDocument("doc", "Chapter 1", "Aria Blackwood met the scholar. Later ARIA left.");

        engine.attach("doc", document, document);
        await(() -> engine.getActiveMatchCount("doc") == 3 && engine.getSchedulerState("doc") == SchedulerState.IDLE);

        assertEquals(List.of("Aria Blackwood=aria-full", "scholar=aria-full", "ARIA=aria"), markedText(document));
        List<ResolvedMatch> matches = engine.getActiveMatches("doc");
        assertEquals(PatternKind.TAG, matches.get(1).getKind());
    }

    @Test
    void mentionsOutsideTheWindowWaitForTheCursor() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"));
        engine = new HighlightEngine(catalog, fastConfig());
        String text = "word ".repeat(1200) + "Aria " + "word ".repeat(299);
        TextDocument document = new TextDocument("doc", "Long", text.trim());

        engine.attach("doc", document, document);
        await(() -> engine.getStats("doc").getApplied() >= 1);
        assertEquals(0, engine.getActiveMatchCount("doc"));

        document.setCursor(document.getText().length());
        await(() -> engine.getActiveMatchCount("doc") == 1);
        assertEquals(List.of("Aria=aria"), markedText(document));
    }

    @Test
    void nameCrossingTheWindowEdgeIsMatchedWhole() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"), entity("aria-full", "Aria Blackwood"));
        engine = new HighlightEngine(catalog, fastConfig());
        String text = "word ".repeat(999) + "Aria Blackwood " + "word ".repeat(499);
        TextDocument document = new TextDocument("doc", "Long", text.trim());

        engine.attach("doc", document, document);
        await(() -> engine.getActiveMatchCount("doc") == 1 && engine.getSchedulerState("doc") == SchedulerState.IDLE);

        assertEquals(List.of("Aria Blackwood=aria-full"), markedText(document));
        ResolvedMatch match = engine.getActiveMatches("doc").get(0);
        assertEquals(4995, match.getStart());
        assertEquals(5009, match.getEnd());
    }

    @Test
    void nameJustPastTheWindowEdgeIsNotCutShort() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"), entity("aria-full", "Aria Blackwood"));
        engine = new HighlightEngine(catalog, fastConfig());
        String text = "word ".repeat(1000) + "Aria Blackwood " + "word ".repeat(499);
        TextDocument document = new TextDocument("doc", "Long", text.trim());

        engine.attach("doc", document, document);
        await(() -> engine.getStats("doc").getApplied() >= 1 && engine.getSchedulerState("doc") == SchedulerState.IDLE);

        assertEquals(0, engine.getActiveMatchCount("doc"));
        assertTrue(document.getMarks().isEmpty());
    }

    @Test
    void rejectedApplyIsAbortedAndRetried() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"));
        engine = new HighlightEngine(catalog, fastConfig());
        TextDocument document = new TextDocument("doc", "Draft", "Aria waits.");
        FailOnceTarget target = new FailOnceTarget(document);

        engine.attach("doc", document, target);
        await(() -> engine.getStats("doc").getAborted() == 1);
        await(() -> engine.getActiveMatchCount("doc") == 1 && engine.getSchedulerState("doc") == SchedulerState.IDLE);

        assertEquals(1, engine.getStats("doc").getAborted());
        assertEquals(2, target.attempts());
        assertEquals(List.of("Aria=aria"), markedText(document));
    }

    @Test
    void staleScanResultIsDiscarded() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"), entity("bran", "Bran"));
        CapturingExecutor scans = new CapturingExecutor();
        engine = new HighlightEngine(catalog, fastConfig(), scans, null);
        TextDocument document = new TextDocument("doc", "Draft", "Aria waits.");

        engine.attach("doc", document, document);
        await(() -> scans.size() == 1);
        document.setText("Bran waits.");
        await(() -> scans.size() == 2);

        scans.get(1).run();
        await(() -> engine.getStats("doc").getApplied() == 1);
        scans.get(0).run();
        await(() -> engine.getStats("doc").getDiscarded() == 1);

        assertEquals(List.of("Bran=bran"), markedText(document));
        for (ResolvedMatch match : engine.getActiveMatches("doc")) {
            assertNotEquals("aria", match.getEntityId());
        }
    }

    @Test
    void marksFollowEdits() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"));
        engine = new HighlightEngine(catalog, fastConfig());
        TextDocument document = new TextDocument("doc", "Draft", "Aria waits.");

        engine.attach("doc", document, document);
        await(() -> engine.getActiveMatchCount("doc") == 1);

        document.edit(0, 0, "Then ");
        await(() -> engine.getActiveMatchCount("doc") == 1
            && engine.getActiveMatches("doc").get(0).getStart() == 5);
        assertEquals(List.of("Aria=aria"), markedText(document));

        document.edit(5, 9, "Bran");
        await(() -> engine.getActiveMatchCount("doc") == 0);
        assertTrue(document.getMarks().isEmpty());
    }

    @Test
    void focusModeSuspendsAndResumes() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"), entity("bran", "Bran"));
        engine = new HighlightEngine(catalog, fastConfig());
        TextDocument document = new TextDocument("doc", "Draft", "Aria waits.");
        engine.attach("doc", document, document);
        await(() -> engine.getActiveMatchCount("doc") == 1);

        engine.suspend("doc");
        await(() -> engine.isSuspended("doc") && engine.getActiveMatchCount("doc") == 0);
        assertTrue(document.getMarks().isEmpty());

        document.setText("Aria and Bran wait.");
        Thread.sleep(50);
        assertTrue(document.getMarks().isEmpty());

        engine.resume("doc");
        await(() -> engine.getActiveMatchCount("doc") == 2);
        assertEquals(List.of("Aria=aria", "Bran=bran"), markedText(document));
    }

    @Test
    void catalogChangeTriggersRescan() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"));
        engine = new HighlightEngine(catalog, fastConfig());
        TextDocument document = new TextDocument("doc", "Draft", "Aria met Bran.");
        engine.attach("doc", document, document);
        await(() -> engine.getActiveMatchCount("doc") == 1);

        catalog.add(entity("bran", "Bran"));

        await(() -> engine.getActiveMatchCount("doc") == 2);
        assertEquals(catalog.getVersion(), engine.currentIndex().getCatalogVersion());
        assertEquals("Bran", engine.describeEntity("bran"));
    }

    @Test
    void overBudgetScanFallsBackToSmallerWindow() throws Exception {
        HighlightConfig config = fastConfig();
        config.setWindowWords(400);
        config.setMinWindowWords(100);
        config.setScanBudgetMs(1);
        AtomicLong clock = new AtomicLong();
        ReferenceScanner slowScanner = new ReferenceScanner(() -> clock.getAndAdd(1_000_000_000L));
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"));
        engine = new HighlightEngine(catalog, config, null, slowScanner);
        String text = ("word ".repeat(10) + "Aria " + "word ".repeat(1489)).trim();
        TextDocument document = new TextDocument("doc", "Long", text);

        engine.attach("doc", document, document);
        await(() -> engine.getStats("doc").getApplied() == 1);

        assertEquals(1, engine.getStats("doc").getDegraded());
        assertEquals(List.of("Aria=aria"), markedText(document));
    }

    @Test
    void attachAndDetach() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"));
        engine = new HighlightEngine(catalog, fastConfig());
        TextDocument document = new TextDocument("doc", "Draft", "Aria waits.");
        engine.attach("doc", document, document);

        assertThrows(IllegalStateException.class, () -> engine.attach("doc", document, document));
        await(() -> engine.getActiveMatchCount("doc") == 1);

        assertTrue(engine.detach("doc"));
        assertFalse(engine.detach("doc"));
        assertFalse(engine.isAttached("doc"));
        assertEquals(0, engine.getActiveMatchCount("doc"));
        assertThrows(NoSuchElementException.class, () -> engine.getActiveMatches("doc"));

        document.setText("Aria and Aria.");
        Thread.sleep(50);
        assertEquals(List.of("Aria=aria"), markedText(document));
    }

    @Test
    void documentsKeepSeparateState() throws Exception {
        InMemoryCatalog catalog = new InMemoryCatalog(entity("aria", "Aria"), entity("bran", "Bran"));
        engine = new HighlightEngine(catalog, fastConfig());
        TextDocument first = new TextDocument("one", "One", "Aria.");
        TextDocument second = new TextDocument("two", "Two", "Bran and Aria.");

        engine.attach("one", first, first);
        engine.attach("two", second, second);
        await(() -> engine.getActiveMatchCount("one") == 1 && engine.getActiveMatchCount("two") == 2);

        assertEquals(List.of("Aria=aria"), markedText(first));
        assertEquals(List.of("Bran=bran", "Aria=aria"), markedText(second));
    }

    static class InMemoryCatalog implements EntityCatalog {
        private final List<Entity> entities = new CopyOnWriteArrayList<>();
        private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
        private final AtomicLong version = new AtomicLong(1);

        InMemoryCatalog(Entity... initial) {
            entities.addAll(List.of(initial));
        }

        void add(Entity entity) {
            entities.add(entity);
            version.incrementAndGet();
            listeners.forEach(Runnable::run);
        }

        @Override
        public List<Entity> getEntities() {
            return new ArrayList<>(entities);
        }

        @Override
        public long getVersion() {
            return version.get();
        }

        @Override
        public void addChangeListener(Runnable listener) {
            listeners.add(listener);
        }

        @Override
        public void removeChangeListener(Runnable listener) {
            listeners.remove(listener);
        }
    }

    static class FailOnceTarget implements MarkTarget {
        private final MarkTarget delegate;
        private final AtomicInteger applies = new AtomicInteger();

        FailOnceTarget(MarkTarget delegate) {
            this.delegate = delegate;
        }

        @Override
        public void applyMark(int start, int end, String entityId) {
            if (applies.incrementAndGet() == 1) {
                throw new StaleApplyException("Offsets moved under [" + start + ", " + end + ")");
            }
            delegate.applyMark(start, end, entityId);
        }

        @Override
        public void removeMark(int start, int end) {
            delegate.removeMark(start, end);
        }

        int attempts() {
            return applies.get();
        }
    }

    static class CapturingExecutor implements Executor {
        private final List<Runnable> tasks = new ArrayList<>();

        @Override
        public synchronized void execute(Runnable command) {
            tasks.add(command);
        }

        synchronized int size() {
            return tasks.size();
        }

        synchronized Runnable get(int i) {
            return tasks.get(i);
        }
    }
}
