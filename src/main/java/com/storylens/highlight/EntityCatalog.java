package com.storylens.highlight;

import com.storylens.models.Entity;

import java.util.List;

/**
 * Source of Story Bible entities. The version must change whenever entries are added,
 * edited or removed.
 */
public interface EntityCatalog {

    List<Entity> getEntities();

    long getVersion();

    default void addChangeListener(Runnable listener) {
    }

    default void removeChangeListener(Runnable listener) {
    }
}
