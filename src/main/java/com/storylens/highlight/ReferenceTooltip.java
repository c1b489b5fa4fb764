package com.storylens.highlight;

import com.storylens.models.Entity;

import java.util.regex.Pattern;

/**
 * Hover text for a story reference mark: "Name: description", markup stripped.
 */
public final class ReferenceTooltip {

    private static final Pattern TAGS = Pattern.compile("<[^>]*>");
    private static final String ELLIPSIS = "...";

    private ReferenceTooltip() {
    }

    public static String describe(Entity entity, int maxDescriptionLength) {
        if (entity == null) {
            return null;
        }
        String name = entity.getDisplayName() != null ? entity.getDisplayName().trim() : "";
        String description = entity.getDescription() != null
            ? TAGS.matcher(entity.getDescription()).replaceAll("").trim()
            : "";
        if (description.isEmpty()) {
            return name;
        }
        int limit = Math.max(ELLIPSIS.length(), maxDescriptionLength);
        if (description.length() > limit) {
            description = description.substring(0, limit - ELLIPSIS.length()) + ELLIPSIS;
        }
        return name + ": " + description;
    }
}
