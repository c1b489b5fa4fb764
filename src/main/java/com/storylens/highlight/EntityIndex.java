package com.storylens.highlight;

import com.storylens.models.Entity;
import com.storylens.models.HighlightConfig;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable lookup structure over the entity catalog.
 *
 * Every entity contributes one pattern for its display name and one per tag. Pattern text
 * is normalized (lower-cased, whitespace collapsed) so lookups are case-insensitive. Entries
 * that cannot be indexed are skipped and reported through {@link #getWarnings()}.
 */
public final class EntityIndex {

    private static final EntityIndex EMPTY = new EntityIndex(-1L, List.of(), Map.of(), List.of());

    private final long catalogVersion;
    private final List<SearchPattern> patterns;
    private final Map<String, List<SearchPattern>> patternsByText;
    private final Map<Character, List<SearchPattern>> patternsByFirstChar;
    private final Map<String, Entity> entitiesById;
    private final List<IndexWarning> warnings;
    private final int maxPatternWords;

    private EntityIndex(long catalogVersion, List<SearchPattern> patterns,
                        Map<String, Entity> entitiesById, List<IndexWarning> warnings) {
        this.catalogVersion = catalogVersion;
        this.patterns = Collections.unmodifiableList(new ArrayList<>(patterns));
        this.entitiesById = Collections.unmodifiableMap(new LinkedHashMap<>(entitiesById));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));

        Map<String, List<SearchPattern>> byText = new LinkedHashMap<>();
        Map<Character, List<SearchPattern>> byFirst = new HashMap<>();
        int longest = 1;
        for (SearchPattern pattern : this.patterns) {
            longest = Math.max(longest, wordCount(pattern.getText()));
            byText.computeIfAbsent(pattern.getText(), k -> new ArrayList<>()).add(pattern);
            byFirst.computeIfAbsent(pattern.getText().charAt(0), k -> new ArrayList<>()).add(pattern);
        }
        byText.replaceAll((k, v) -> Collections.unmodifiableList(v));
        byFirst.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.patternsByText = Collections.unmodifiableMap(byText);
        this.patternsByFirstChar = Collections.unmodifiableMap(byFirst);
        this.maxPatternWords = longest;
    }

    private static int wordCount(String normalized) {
        int words = 1;
        for (int i = 0; i < normalized.length(); i++) {
            if (normalized.charAt(i) == ' ') {
                words++;
            }
        }
        return words;
    }

    public static EntityIndex empty() {
        return EMPTY;
    }

    public static EntityIndex build(List<Entity> entities) {
        return build(CatalogSnapshot.of(0L, entities), HighlightConfig.defaults());
    }

    public static EntityIndex build(CatalogSnapshot snapshot, HighlightConfig config) {
        Objects.requireNonNull(snapshot, "snapshot");
        HighlightConfig settings = config != null ? config : HighlightConfig.defaults();

        List<SearchPattern> patterns = new ArrayList<>();
        Map<String, Entity> entities = new LinkedHashMap<>();
        List<IndexWarning> warnings = new ArrayList<>();

        for (Entity entity : snapshot.getEntities()) {
            if (entity == null) {
                warnings.add(new IndexWarning(null, IndexWarning.Reason.MISSING_ENTITY, null));
                continue;
            }
            String id = entity.getId();
            if (id == null || id.isBlank()) {
                warnings.add(new IndexWarning(null, IndexWarning.Reason.MISSING_ID, entity.getDisplayName()));
                continue;
            }
            String name = entity.getDisplayName();
            if (name == null || name.isBlank()) {
                warnings.add(new IndexWarning(id, IndexWarning.Reason.BLANK_NAME, null));
                continue;
            }
            if (name.trim().length() > settings.getMaxNameLength()) {
                warnings.add(new IndexWarning(id, IndexWarning.Reason.NAME_TOO_LONG,
                    name.trim().length() + " chars"));
                continue;
            }
            if (entities.containsKey(id)) {
                warnings.add(new IndexWarning(id, IndexWarning.Reason.DUPLICATE_ID, name.trim()));
                continue;
            }
            entities.put(id, entity);

            Set<String> seen = new LinkedHashSet<>();
            addPattern(patterns, seen, normalize(name), id, PatternKind.NAME, settings);

            List<String> tags = entity.getTags() != null ? entity.getTags() : List.of();
            int tagCount = 0;
            for (String tag : tags) {
                if (tag == null || tag.isBlank()) {
                    continue;
                }
                if (tagCount >= settings.getMaxTags()) {
                    warnings.add(new IndexWarning(id, IndexWarning.Reason.TOO_MANY_TAGS,
                        "indexed first " + settings.getMaxTags()));
                    break;
                }
                tagCount++;
                if (tag.trim().length() > settings.getMaxTagLength()) {
                    warnings.add(new IndexWarning(id, IndexWarning.Reason.TAG_TOO_LONG, tag.trim()));
                    continue;
                }
                addPattern(patterns, seen, normalize(tag), id, PatternKind.TAG, settings);
            }
        }
        return new EntityIndex(snapshot.getVersion(), patterns, entities, warnings);
    }

    private static void addPattern(List<SearchPattern> patterns, Set<String> seen, String text,
                                   String entityId, PatternKind kind, HighlightConfig settings) {
        if (text.length() < settings.getMinPatternLength() || !seen.add(text)) {
            return;
        }
        patterns.add(new SearchPattern(patterns.size(), text, entityId, kind));
    }

    /**
     * Lower-cases each character and collapses whitespace runs to one space, trimming the ends.
     * Character-wise lowering keeps the result aligned with document offsets.
     */
    public static String normalize(CharSequence raw) {
        if (raw == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder(raw.length());
        boolean pendingSpace = false;
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (Character.isWhitespace(c)) {
                pendingSpace = sb.length() > 0;
                continue;
            }
            if (pendingSpace) {
                sb.append(' ');
                pendingSpace = false;
            }
            sb.append(Character.toLowerCase(c));
        }
        return sb.toString();
    }

    public long getCatalogVersion() {
        return catalogVersion;
    }

    public List<SearchPattern> getPatterns() {
        return patterns;
    }

    public SearchPattern getPattern(int patternId) {
        if (patternId < 0 || patternId >= patterns.size()) {
            throw new IllegalArgumentException("Unknown pattern id: " + patternId);
        }
        return patterns.get(patternId);
    }

    /**
     * Patterns whose normalized text equals the normalized form of {@code text}.
     */
    public List<SearchPattern> lookup(CharSequence text) {
        return patternsByText.getOrDefault(normalize(text), List.of());
    }

    List<SearchPattern> candidatesStartingWith(char lowerFirst) {
        return patternsByFirstChar.getOrDefault(lowerFirst, List.of());
    }

    public Entity getEntity(String entityId) {
        return entityId != null ? entitiesById.get(entityId) : null;
    }

    public int getEntityCount() {
        return entitiesById.size();
    }

    public List<IndexWarning> getWarnings() {
        return warnings;
    }

    /**
     * Word count of the longest pattern; 1 for an empty index.
     */
    public int getMaxPatternWords() {
        return maxPatternWords;
    }

    public boolean isEmpty() {
        return patterns.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EntityIndex)) return false;
        EntityIndex that = (EntityIndex) o;
        return catalogVersion == that.catalogVersion
            && patterns.equals(that.patterns)
            && entitiesById.keySet().equals(that.entitiesById.keySet())
            && warnings.equals(that.warnings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(catalogVersion, patterns, entitiesById.keySet(), warnings);
    }
}
