package com.williamcallahan.reverse_image_search.model;

import java.util.Optional;

public enum SearchEngineName {
    SAUCENAO("saucenao", "SauceNAO"),
    IQDB("iqdb", "IQDB");

    private final String id;
    private final String displayName;

    SearchEngineName(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves either the identifier ("saucenao") or the display name ("SauceNAO")
     */
    public static Optional<SearchEngineName> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String trimmed = name.trim();
        for (SearchEngineName engine : values()) {
            if (engine.id.equalsIgnoreCase(trimmed) || engine.displayName.equalsIgnoreCase(trimmed)) {
                return Optional.of(engine);
            }
        }
        return Optional.empty();
    }
}
