package com.storylens.highlight;

import java.util.Collections;
import java.util.List;

/**
 * Resolved matches for a request. The request may be a shrunk, degraded version of the one
 * originally submitted if the scan ran over budget.
 */
public final class ScanResult {
    private final ScanRequest request;
    private final List<ResolvedMatch> matches;

    public ScanResult(ScanRequest request, List<ResolvedMatch> matches) {
        this.request = request;
        this.matches = Collections.unmodifiableList(matches);
    }

    public ScanRequest getRequest() {
        return request;
    }

    public List<ResolvedMatch> getMatches() {
        return matches;
    }

    public boolean isDegraded() {
        return request.isDegraded();
    }
}
