package com.storylens;

import com.storylens.highlight.EntityCatalog;
import com.storylens.models.Entity;
import com.storylens.storage.JsonStorage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Story Bible entries for one workspace, kept in .storylens/entities.json.
 *
 * Every successful mutation advances {@link #getVersion()} and notifies listeners, which is
 * how the highlighter learns it has to rebuild its index.
 */
public class EntityCatalogStore implements EntityCatalog {

    public static final int MAX_NAME_LENGTH = 200;
    public static final int MAX_TAG_LENGTH = 50;
    public static final int MAX_TAGS = 50;
    public static final int MAX_DESCRIPTION_LENGTH = 100_000;

    private final Path storagePath;
    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final AtomicLong version = new AtomicLong();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final AppLogger logger = AppLogger.get();

    public EntityCatalogStore(Path dataPath) {
        this.storagePath = dataPath.resolve("entities.json");
        loadFromDisk();
    }

    @Override
    public synchronized List<Entity> getEntities() {
        List<Entity> copies = new ArrayList<>();
        for (Entity entity : entities.values()) {
            copies.add(entity.copy());
        }
        return copies;
    }

    @Override
    public long getVersion() {
        return version.get();
    }

    @Override
    public void addChangeListener(Runnable listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    @Override
    public void removeChangeListener(Runnable listener) {
        listeners.remove(listener);
    }

    public synchronized Entity get(String id) {
        Entity entity = id != null ? entities.get(id) : null;
        if (entity == null) {
            throw new NoSuchElementException("Entity not found: " + id);
        }
        return entity.copy();
    }

    public Entity create(Entity draft) {
        Entity created;
        synchronized (this) {
            validate(draft);
            created = draft.copy();
            created.setId(UUID.randomUUID().toString());
            created.setDisplayName(draft.getDisplayName().trim());
            long now = System.currentTimeMillis();
            created.setCreatedAt(now);
            created.setUpdatedAt(now);
            Map<String, Entity> next = new LinkedHashMap<>(entities);
            next.put(created.getId(), created);
            commit(next);
        }
        log("Entity created: " + created.getId() + " (" + created.getDisplayName() + ")");
        notifyListeners();
        return created.copy();
    }

    public Entity update(String id, Entity changes) {
        Entity updated;
        synchronized (this) {
            Entity existing = id != null ? entities.get(id) : null;
            if (existing == null) {
                throw new NoSuchElementException("Entity not found: " + id);
            }
            validate(changes);
            updated = changes.copy();
            updated.setId(id);
            updated.setDisplayName(changes.getDisplayName().trim());
            updated.setCreatedAt(existing.getCreatedAt());
            updated.setUpdatedAt(System.currentTimeMillis());
            Map<String, Entity> next = new LinkedHashMap<>(entities);
            next.put(id, updated);
            commit(next);
        }
        log("Entity updated: " + id);
        notifyListeners();
        return updated.copy();
    }

    public boolean delete(String id) {
        synchronized (this) {
            if (id == null || !entities.containsKey(id)) {
                return false;
            }
            Map<String, Entity> next = new LinkedHashMap<>(entities);
            next.remove(id);
            commit(next);
        }
        log("Entity deleted: " + id);
        notifyListeners();
        return true;
    }

    /**
     * Case-insensitive search over names, tags and descriptions, name hits first.
     */
    public synchronized List<Entity> search(String query) {
        List<Entity> results = new ArrayList<>();
        if (query == null || query.isBlank()) {
            return results;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<Entity> weaker = new ArrayList<>();
        for (Entity entity : entities.values()) {
            if (contains(entity.getDisplayName(), needle)) {
                results.add(entity.copy());
            } else if (entity.getTags().stream().anyMatch(tag -> contains(tag, needle))
                || contains(entity.getDescription(), needle)) {
                weaker.add(entity.copy());
            }
        }
        results.addAll(weaker);
        return results;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    /**
     * Rejects entries the editor should never save. The index tolerates bad entries that reach
     * it by other routes (hand-edited files); this is the stricter front door.
     */
    static void validate(Entity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("Entity body is required");
        }
        String name = entity.getDisplayName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Entry name is required");
        }
        if (name.trim().length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Entry name must be less than " + MAX_NAME_LENGTH + " characters");
        }
        if (entity.getDescription() != null && entity.getDescription().length() > MAX_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException("Description exceeds maximum length");
        }
        if (entity.getTags().size() > MAX_TAGS) {
            throw new IllegalArgumentException("Too many tags (maximum " + MAX_TAGS + ")");
        }
        for (String tag : entity.getTags()) {
            if (tag != null && tag.length() > MAX_TAG_LENGTH) {
                throw new IllegalArgumentException("Tag too long (maximum " + MAX_TAG_LENGTH + " characters)");
            }
        }
    }

    private void loadFromDisk() {
        try {
            List<Entity> stored = JsonStorage.readJsonList(storagePath, Entity[].class);
            int skipped = 0;
            for (Entity entity : stored) {
                if (entity.getId() == null || entity.getId().isBlank()) {
                    skipped++;
                    continue;
                }
                entities.put(entity.getId(), entity);
            }
            if (!stored.isEmpty()) {
                version.incrementAndGet();
            }
            log("Loaded " + entities.size() + " entit(ies) from " + storagePath
                + (skipped > 0 ? " (" + skipped + " without id skipped)" : ""));
        } catch (IOException e) {
            logWarning("Failed to load entities from " + storagePath + ": " + e.getMessage());
        }
    }

    /**
     * Writes {@code next} to disk and only then makes it the live catalog. A failed write
     * leaves the catalog and its version as they were.
     */
    private void commit(Map<String, Entity> next) {
        try {
            JsonStorage.writeJsonList(storagePath, new ArrayList<>(next.values()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save entities to " + storagePath, e);
        }
        entities.clear();
        entities.putAll(next);
        version.incrementAndGet();
    }

    private void notifyListeners() {
        for (Runnable listener : listeners) {
            try {
                listener.run();
            } catch (RuntimeException e) {
                logWarning("Catalog listener failed: " + e.getMessage());
            }
        }
    }

    private void log(String message) {
        if (logger != null) {
            logger.info("[EntityCatalogStore] " + message);
        }
    }

    private void logWarning(String message) {
        if (logger != null) {
            logger.warn("[EntityCatalogStore] " + message);
        }
    }
}
