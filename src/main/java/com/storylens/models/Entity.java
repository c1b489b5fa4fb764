package com.storylens.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * A Story Bible entry: a named character, location, item, piece of lore or custom element.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Entity {
    private String id;
    private String displayName;
    private EntityType type = EntityType.CUSTOM;
    private String description;
    private List<String> tags = new ArrayList<>();
    private List<String> rules = new ArrayList<>();
    private long createdAt;
    private long updatedAt;

    public Entity() {
    }

    public Entity(String id, String displayName, EntityType type) {
        this.id = id;
        this.displayName = displayName;
        setType(type);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }

    public EntityType getType() {
        return type;
    }

    public void setType(EntityType type) {
        this.type = type != null ? type : EntityType.CUSTOM;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Tags are an ordered set: duplicates are dropped, first occurrence wins.
     */
    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(new LinkedHashSet<>(tags)) : new ArrayList<>();
    }

    public List<String> getRules() {
        return rules;
    }

    public void setRules(List<String> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Entity copy() {
        Entity copy = new Entity(id, displayName, type);
        copy.setDescription(description);
        copy.setTags(tags);
        copy.setRules(rules);
        copy.setCreatedAt(createdAt);
        copy.setUpdatedAt(updatedAt);
        return copy;
    }
}
