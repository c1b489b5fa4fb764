package com.storylens.highlight;

import com.storylens.models.Entity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only copy of the entity catalog at one version.
 */
public final class CatalogSnapshot {
    private final long version;
    private final List<Entity> entities;

    private CatalogSnapshot(long version, List<Entity> entities) {
        this.version = version;
        this.entities = entities;
    }

    public static CatalogSnapshot of(long version, List<Entity> source) {
        List<Entity> copies = new ArrayList<>();
        if (source != null) {
            for (Entity entity : source) {
                copies.add(entity != null ? entity.copy() : null);
            }
        }
        return new CatalogSnapshot(version, Collections.unmodifiableList(copies));
    }

    public static CatalogSnapshot capture(EntityCatalog catalog) {
        // Read the version first so a concurrent edit can only make the snapshot look older.
        long version = catalog.getVersion();
        return of(version, catalog.getEntities());
    }

    public long getVersion() {
        return version;
    }

    public List<Entity> getEntities() {
        return entities;
    }
}
