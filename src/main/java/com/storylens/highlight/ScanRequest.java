package com.storylens.highlight;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable unit of scan work. The revision is the document's highlight revision at the
 * moment the request was built; the result is only applied if that revision is still current.
 *
 * The scanned range may reach a few words past the window on either side so that a name
 * crossing a window edge is seen whole. Only matches touching the window itself are kept.
 */
public final class ScanRequest {
    private final String documentId;
    private final int windowStart;
    private final int windowEnd;
    private final int coreStart;
    private final int coreEnd;
    private final String text;
    private final long revision;
    private final EntityIndex index;
    private final boolean degraded;

    public ScanRequest(String documentId, ScanWindow window, String fullText, long revision, EntityIndex index) {
        this(documentId, window, window, fullText, revision, index);
    }

    /**
     * @param scanRange the range actually scanned; must contain {@code window}
     */
    public ScanRequest(String documentId, ScanWindow window, ScanWindow scanRange, String fullText, long revision,
                       EntityIndex index) {
        Objects.requireNonNull(window, "window");
        Objects.requireNonNull(scanRange, "scanRange");
        Objects.requireNonNull(fullText, "fullText");
        if (scanRange.getEnd() > fullText.length()) {
            throw new IllegalArgumentException("Window " + scanRange + " exceeds text length " + fullText.length());
        }
        if (scanRange.getStart() > window.getStart() || scanRange.getEnd() < window.getEnd()) {
            throw new IllegalArgumentException("Scan range " + scanRange + " does not contain window " + window);
        }
        this.documentId = documentId;
        this.windowStart = scanRange.getStart();
        this.windowEnd = scanRange.getEnd();
        this.coreStart = window.getStart();
        this.coreEnd = window.getEnd();
        this.text = fullText.substring(scanRange.getStart(), scanRange.getEnd());
        this.revision = revision;
        this.index = Objects.requireNonNull(index, "index");
        this.degraded = window.isDegraded();
    }

    public String getDocumentId() {
        return documentId;
    }

    /**
     * Start of the scanned range; match offsets in {@link #getText()} are relative to it.
     */
    public int getWindowStart() {
        return windowStart;
    }

    public int getWindowEnd() {
        return windowEnd;
    }

    /**
     * The scanned slice of the document text.
     */
    public String getText() {
        return text;
    }

    public long getRevision() {
        return revision;
    }

    public EntityIndex getIndex() {
        return index;
    }

    public boolean isDegraded() {
        return degraded;
    }

    /**
     * The window chosen by {@link WindowPolicy}, without the edge margin.
     */
    public ScanWindow getWindow() {
        return new ScanWindow(coreStart, coreEnd, degraded);
    }

    /**
     * Drops matches that lie wholly in the edge margin; those may be cut-off parts of a longer
     * name that continues past the scanned range.
     */
    public List<RawMatch> withinWindow(List<RawMatch> matches) {
        int from = coreStart - windowStart;
        int to = coreEnd - windowStart;
        if (from == 0 && to == text.length()) {
            return matches;
        }
        List<RawMatch> kept = new ArrayList<>();
        for (RawMatch match : matches) {
            if (match.getStart() < to && match.getEnd() > from) {
                kept.add(match);
            }
        }
        return kept;
    }

    @Override
    public String toString() {
        return "ScanRequest{" + documentId + " rev=" + revision + " [" + coreStart + ", " + coreEnd + ")"
            + (degraded ? " degraded" : "") + "}";
    }
}
