package com.storylens.highlight;

import com.storylens.AppLogger;
import com.storylens.models.HighlightConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.stream.Collectors;

/**
 * Entry point of the reference highlighter.
 *
 * Holds the entity index for the current catalog version and one {@link DocumentHighlighter}
 * per attached document. Highlight state is never shared between documents.
 */
public class HighlightEngine implements AutoCloseable {

    private static final int MAX_LOGGED_WARNINGS = 5;

    private final EntityCatalog catalog;
    private final HighlightConfig config;
    private final ScheduledExecutorService scheduler;
    private final Executor scanExecutor;
    private final ReferenceScanner scanner;
    private final Map<String, DocumentHighlighter> documents = new ConcurrentHashMap<>();
    private final Runnable catalogListener = this::onCatalogChanged;
    private final Object indexLock = new Object();
    private final AppLogger logger = AppLogger.get();
    private volatile EntityIndex index = EntityIndex.empty();

    public HighlightEngine(EntityCatalog catalog, HighlightConfig config) {
        this(catalog, config, null, null);
    }

    /**
     * @param scanExecutor where scans run; null runs them on the scheduler thread
     * @param scanner scanner to use; null for the default clock
     */
    public HighlightEngine(EntityCatalog catalog, HighlightConfig config, Executor scanExecutor,
                           ReferenceScanner scanner) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.config = config != null ? config : HighlightConfig.defaults();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(schedulerThreadFactory());
        this.scanExecutor = scanExecutor != null ? scanExecutor : scheduler;
        this.scanner = scanner != null ? scanner : new ReferenceScanner();
        refreshIndex();
        catalog.addChangeListener(catalogListener);
    }

    /**
     * Starts highlighting a document. An initial scan is scheduled right away.
     */
    public DocumentHighlighter attach(String documentId, DocumentModel document, MarkTarget target) {
        Objects.requireNonNull(documentId, "documentId");
        DocumentHighlighter highlighter = new DocumentHighlighter(documentId, document, target, config,
            scheduler, scanExecutor, this::currentIndex, scanner);
        if (documents.putIfAbsent(documentId, highlighter) != null) {
            throw new IllegalStateException("Document already attached: " + documentId);
        }
        document.addChangeListener(highlighter);
        highlighter.onTextChanged();
        log("Attached document " + documentId);
        return highlighter;
    }

    /**
     * Stops highlighting a document and drops its highlight state. Marks already in the editor
     * are left in place.
     */
    public boolean detach(String documentId) {
        DocumentHighlighter highlighter = documentId != null ? documents.remove(documentId) : null;
        if (highlighter == null) {
            return false;
        }
        highlighter.getDocument().removeChangeListener(highlighter);
        highlighter.detach();
        log("Detached document " + documentId);
        return true;
    }

    public boolean isAttached(String documentId) {
        return documentId != null && documents.containsKey(documentId);
    }

    public List<String> getDocumentIds() {
        return new ArrayList<>(documents.keySet());
    }

    public void suspend(String documentId) {
        require(documentId).suspend();
    }

    public void resume(String documentId) {
        require(documentId).resume();
    }

    public void rescanNow(String documentId) {
        require(documentId).rescanNow();
    }

    public int getActiveMatchCount(String documentId) {
        DocumentHighlighter highlighter = documentId != null ? documents.get(documentId) : null;
        return highlighter != null ? highlighter.getHighlightState().getActiveMatchCount() : 0;
    }

    public List<ResolvedMatch> getActiveMatches(String documentId) {
        return require(documentId).getHighlightState().getActiveMatches();
    }

    public long getRevision(String documentId) {
        return require(documentId).getHighlightState().getRevision();
    }

    public SchedulerState getSchedulerState(String documentId) {
        return require(documentId).getState();
    }

    public HighlightStats getStats(String documentId) {
        return require(documentId).getStats();
    }

    public boolean isSuspended(String documentId) {
        return require(documentId).isSuspended();
    }

    /**
     * Tooltip for an entity in the current index, or null when it is not indexed.
     */
    public String describeEntity(String entityId) {
        return ReferenceTooltip.describe(currentIndex().getEntity(entityId), config.getTooltipMaxLength());
    }

    /**
     * The index for the catalog's current version, rebuilding it first if the catalog moved on.
     */
    public EntityIndex currentIndex() {
        return refreshIndex();
    }

    public HighlightConfig getConfig() {
        return config;
    }

    /**
     * Rebuilds the index if needed and schedules a rescan of every attached document.
     */
    public void onCatalogChanged() {
        try {
            scheduler.execute(() -> {
                try {
                    refreshIndex();
                    documents.values().forEach(DocumentHighlighter::onCatalogChanged);
                } catch (RuntimeException e) {
                    logError("Catalog refresh failed", e);
                }
            });
        } catch (RejectedExecutionException e) {
            logWarning("Scheduler stopped; catalog change ignored");
        }
    }

    private EntityIndex refreshIndex() {
        synchronized (indexLock) {
            long version = catalog.getVersion();
            EntityIndex existing = index;
            if (version == existing.getCatalogVersion()) {
                return existing;
            }
            EntityIndex rebuilt = EntityIndex.build(CatalogSnapshot.capture(catalog), config);
            index = rebuilt;
            log("Indexed " + rebuilt.getPatterns().size() + " pattern(s) from "
                + rebuilt.getEntityCount() + " entit(ies), catalog version " + rebuilt.getCatalogVersion());
            List<IndexWarning> warnings = rebuilt.getWarnings();
            if (!warnings.isEmpty()) {
                String sample = warnings.stream()
                    .limit(MAX_LOGGED_WARNINGS)
                    .map(IndexWarning::toString)
                    .collect(Collectors.joining(", "));
                logWarning("Skipped " + warnings.size() + " catalog entr(ies) while indexing: " + sample
                    + (warnings.size() > MAX_LOGGED_WARNINGS ? ", ..." : ""));
            }
            return rebuilt;
        }
    }

    private DocumentHighlighter require(String documentId) {
        DocumentHighlighter highlighter = documentId != null ? documents.get(documentId) : null;
        if (highlighter == null) {
            throw new NoSuchElementException("Document not attached: " + documentId);
        }
        return highlighter;
    }

    @Override
    public void close() {
        catalog.removeChangeListener(catalogListener);
        for (String documentId : getDocumentIds()) {
            detach(documentId);
        }
        scheduler.shutdownNow();
    }

    private ThreadFactory schedulerThreadFactory() {
        return r -> {
            Thread t = new Thread(r, "highlight-scheduler");
            t.setDaemon(true);
            return t;
        };
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[HighlightEngine] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[HighlightEngine] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        if (logger != null) {
            logger.error("[HighlightEngine] " + message, t);
        }
    }
}
