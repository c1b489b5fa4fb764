package com.storylens.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum EntityType {
    CHARACTER("Character"),
    LOCATION("Location"),
    ITEM("Item"),
    LORE("Lore"),
    CUSTOM("Custom");

    private final String label;

    EntityType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Lenient lookup: accepts labels ("Character") and constant names ("CHARACTER").
     * Unknown or missing values fall back to CUSTOM.
     */
    @JsonCreator
    public static EntityType fromString(String value) {
        if (value == null || value.isBlank()) {
            return CUSTOM;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (EntityType type : values()) {
            if (type.name().equals(normalized)) {
                return type;
            }
        }
        return CUSTOM;
    }
}
