package com.storylens.highlight;

import com.storylens.AppLogger;
import com.storylens.models.HighlightConfig;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Keeps one document's story reference marks in step with its text.
 *
 * IDLE -> PENDING on every text or selection change (revision bumped, debounce re-armed);
 * PENDING -> SCANNING when the debounce elapses; SCANNING -> APPLYING only if the request's
 * revision is still current, otherwise the result is dropped; APPLYING -> IDLE once the diff
 * is in the editor. An apply that finds the document changed is abandoned and PENDING re-armed.
 *
 * All transitions run on the engine's scheduler thread. Scans may run elsewhere.
 */
public class DocumentHighlighter implements DocumentChangeListener {

    private final String documentId;
    private final DocumentModel document;
    private final MarkTarget target;
    private final HighlightConfig config;
    private final ScheduledExecutorService owner;
    private final Executor scanExecutor;
    private final Supplier<EntityIndex> indexSource;
    private final WindowPolicy windowPolicy;
    private final ReferenceScanner scanner;
    private final OverlapResolver resolver;
    private final HighlightApplier applier;
    private final HighlightState state;
    private final HighlightStats stats = new HighlightStats();
    private final AppLogger logger = AppLogger.get();

    private volatile SchedulerState phase = SchedulerState.IDLE;
    private volatile boolean suspended;
    private volatile boolean detached;

    // Scheduler thread only.
    private ScheduledFuture<?> debounce;
    private ScanWindow lastWindow;
    private int inFlight;

    DocumentHighlighter(String documentId, DocumentModel document, MarkTarget target, HighlightConfig config,
                        ScheduledExecutorService owner, Executor scanExecutor, Supplier<EntityIndex> indexSource,
                        ReferenceScanner scanner) {
        this.documentId = Objects.requireNonNull(documentId, "documentId");
        this.document = Objects.requireNonNull(document, "document");
        this.target = Objects.requireNonNull(target, "target");
        this.config = config != null ? config : HighlightConfig.defaults();
        this.owner = Objects.requireNonNull(owner, "owner");
        this.scanExecutor = scanExecutor != null ? scanExecutor : owner;
        this.indexSource = Objects.requireNonNull(indexSource, "indexSource");
        this.windowPolicy = new WindowPolicy(this.config);
        this.scanner = scanner != null ? scanner : new ReferenceScanner();
        this.resolver = new OverlapResolver();
        this.applier = new HighlightApplier();
        this.state = new HighlightState(documentId);
    }

    @Override
    public void onTextChanged() {
        submit(this::handleChange);
    }

    @Override
    public void onSelectionChanged() {
        submit(this::handleChange);
    }

    void onCatalogChanged() {
        submit(this::handleChange);
    }

    /**
     * Skips the debounce and scans on the next scheduler turn.
     */
    public void rescanNow() {
        submit(() -> {
            if (detached || suspended) {
                return;
            }
            cancelDebounce();
            state.bumpRevision();
            startScan();
        });
    }

    /**
     * Removes all marks and ignores changes until {@link #resume()}. Used by focus mode.
     */
    public void suspend() {
        submit(() -> {
            if (detached || suspended) {
                return;
            }
            suspended = true;
            cancelDebounce();
            int removed = applier.clear(state, document, target);
            settle();
            log("Highlighting suspended for " + documentId + " (" + removed + " mark(s) removed)");
        });
    }

    public void resume() {
        submit(() -> {
            if (detached || !suspended) {
                return;
            }
            suspended = false;
            log("Highlighting resumed for " + documentId);
            handleChange();
        });
    }

    void detach() {
        submit(() -> {
            detached = true;
            cancelDebounce();
            phase = SchedulerState.IDLE;
        });
    }

    private void handleChange() {
        if (detached || suspended) {
            return;
        }
        state.bumpRevision();
        armDebounce(config.getDebounceMs());
        if (phase != SchedulerState.SCANNING) {
            phase = SchedulerState.PENDING;
        }
    }

    private void armDebounce(long delayMs) {
        cancelDebounce();
        try {
            debounce = owner.schedule(() -> runGuarded(this::onDebounceElapsed),
                Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            debounce = null;
            logWarning("Scheduler stopped; debounce not armed for " + documentId);
        }
    }

    private void cancelDebounce() {
        if (debounce != null) {
            debounce.cancel(false);
            debounce = null;
        }
    }

    private void onDebounceElapsed() {
        debounce = null;
        if (detached || suspended) {
            settle();
            return;
        }
        startScan();
    }

    private void startScan() {
        String text = document.getText();
        String fullText = text != null ? text : "";
        int cursor = Math.max(0, Math.min(document.getCursorOffset(), fullText.length()));
        EntityIndex index = indexSource.get();
        ScanWindow window = windowPolicy.computeWindow(fullText, cursor, lastWindow);
        ScanRequest request = buildRequest(window, fullText, state.getRevision(), index);

        phase = SchedulerState.SCANNING;
        inFlight++;
        stats.recordScan();
        try {
            CompletableFuture
                .supplyAsync(() -> runScan(request, fullText, cursor), scanExecutor)
                .whenComplete((result, error) -> submit(() -> onScanComplete(request, result, error)));
        } catch (RejectedExecutionException e) {
            inFlight--;
            stats.recordFailed();
            logWarning("Scan executor rejected " + request);
            settle();
        }
    }

    /**
     * Runs on the scan executor. Retries on successively smaller windows when the time budget
     * is exceeded; the smallest window is scanned without a budget so the pass always ends.
     */
    private ScanResult runScan(ScanRequest request, String fullText, int cursor) {
        long budgetNanos = TimeUnit.MILLISECONDS.toNanos(Math.max(0L, config.getScanBudgetMs()));
        ScanRequest current = request;
        int words = windowPolicy.windowWords();
        while (true) {
            boolean lastAttempt = words <= windowPolicy.minWords();
            try {
                List<RawMatch> raw = scanner.scan(current.getText(), current.getIndex(), lastAttempt ? 0L : budgetNanos);
                if (current.isDegraded()) {
                    stats.recordDegraded();
                }
                List<ResolvedMatch> matches =
                    resolver.resolve(current.withinWindow(raw), current.getIndex(), current.getWindowStart());
                return new ScanResult(current, matches);
            } catch (ScanBudgetExceededException e) {
                words = Math.max(windowPolicy.minWords(), words / 2);
                logWarning("Scan over budget for " + documentId + " (" + e.getMessage()
                    + "); retrying with " + words + " words");
                ScanWindow smaller = windowPolicy.shrink(fullText, cursor, words);
                current = buildRequest(smaller, fullText, request.getRevision(), request.getIndex());
            }
        }
    }

    // Names crossing a window edge are scanned whole, then only matches touching the window are kept.
    private ScanRequest buildRequest(ScanWindow window, String fullText, long revision, EntityIndex index) {
        ScanWindow scanRange = windowPolicy.widen(fullText, window, index.getMaxPatternWords() - 1);
        return new ScanRequest(documentId, window, scanRange, fullText, revision, index);
    }

    private void onScanComplete(ScanRequest request, ScanResult result, Throwable error) {
        inFlight = Math.max(0, inFlight - 1);
        if (detached) {
            return;
        }
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause() : error;
            stats.recordFailed();
            logError("Scan failed for " + request, cause);
            settle();
            return;
        }
        if (suspended || request.getRevision() != state.getRevision()) {
            stats.recordDiscarded();
            settle();
            return;
        }

        phase = SchedulerState.APPLYING;
        try {
            ApplyOutcome outcome = applier.reconcile(state, result.getRequest(), result.getMatches(), document, target);
            debug("Applied " + result.getRequest() + " " + outcome);
            lastWindow = result.getRequest().getWindow();
            stats.recordApplied();
            settle();
        } catch (StaleApplyException e) {
            stats.recordAborted();
            logWarning("Apply aborted for " + documentId + ": " + e.getMessage());
            state.bumpRevision();
            armDebounce(config.getDebounceMs());
            phase = SchedulerState.PENDING;
        }
    }

    private void settle() {
        if (debounce != null) {
            phase = SchedulerState.PENDING;
        } else if (inFlight > 0) {
            phase = SchedulerState.SCANNING;
        } else {
            phase = SchedulerState.IDLE;
        }
    }

    private void submit(Runnable task) {
        try {
            owner.execute(() -> runGuarded(task));
        } catch (RejectedExecutionException e) {
            logWarning("Scheduler stopped; dropped event for " + documentId);
        }
    }

    private void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            stats.recordFailed();
            logError("Highlighter task failed for " + documentId, e);
            settle();
        }
    }

    public String getDocumentId() {
        return documentId;
    }

    public SchedulerState getState() {
        return phase;
    }

    public HighlightState getHighlightState() {
        return state;
    }

    public HighlightStats getStats() {
        return stats;
    }

    public boolean isSuspended() {
        return suspended;
    }

    DocumentModel getDocument() {
        return document;
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[DocumentHighlighter] " + message);
        }
    }

    private void debug(String message) {
        if (logger != null) {
            logger.debug("[DocumentHighlighter] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[DocumentHighlighter] " + message);
        }
    }

    private void logError(String message, Throwable t) {
        if (logger != null) {
            logger.error("[DocumentHighlighter] " + message, t);
        }
    }
}
