package com.storylens.highlight;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reduces raw matches to a non-overlapping set: longest span first, earlier start on ties,
 * lower pattern id after that. A match is kept only if it overlaps nothing kept before it,
 * so "Aria Blackwood" wins over the "Aria" inside it.
 */
public class OverlapResolver {

    static final Comparator<RawMatch> PRIORITY = Comparator
        .comparingInt(RawMatch::length).reversed()
        .thenComparingInt(RawMatch::getStart)
        .thenComparingInt(RawMatch::getPatternId);

    /**
     * @return the accepted matches ordered by start offset
     */
    public List<RawMatch> select(List<RawMatch> matches) {
        if (matches == null || matches.isEmpty()) {
            return new ArrayList<>();
        }
        List<RawMatch> ordered = new ArrayList<>(matches);
        ordered.sort(PRIORITY);

        // Accepted spans never overlap, so only the neighbours around a start can collide.
        TreeMap<Integer, RawMatch> accepted = new TreeMap<>();
        for (RawMatch match : ordered) {
            Map.Entry<Integer, RawMatch> before = accepted.floorEntry(match.getStart());
            if (before != null && before.getValue().overlaps(match)) {
                continue;
            }
            Map.Entry<Integer, RawMatch> after = accepted.ceilingEntry(match.getStart());
            if (after != null && after.getValue().overlaps(match)) {
                continue;
            }
            accepted.put(match.getStart(), match);
        }
        return new ArrayList<>(accepted.values());
    }

    public List<ResolvedMatch> resolve(List<RawMatch> matches, EntityIndex index) {
        return resolve(matches, index, 0);
    }

    /**
     * Selects the surviving matches and moves them into document coordinates.
     */
    public List<ResolvedMatch> resolve(List<RawMatch> matches, EntityIndex index, int windowStart) {
        List<ResolvedMatch> resolved = new ArrayList<>();
        for (RawMatch match : select(matches)) {
            resolved.add(ResolvedMatch.from(match, index.getPattern(match.getPatternId()), windowStart));
        }
        return resolved;
    }
}
