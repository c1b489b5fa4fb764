package com.storylens.highlight;

public final class ReferenceBadge {

    private ReferenceBadge() {
    }

    /**
     * "1 Story Bible reference", "3 Story Bible references".
     */
    public static String label(int count) {
        return count + " Story Bible " + (count == 1 ? "reference" : "references");
    }
}
