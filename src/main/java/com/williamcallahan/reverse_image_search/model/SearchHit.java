package com.williamcallahan.reverse_image_search.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One unresolved candidate match produced by a search engine
 *
 * @param searchProvider engine that produced the hit
 * @param platform platform the hit was classified into, {@link Platform#UNKNOWN} when unclassified
 * @param platformId platform-local post or work identifier
 * @param similarity match confidence in [0,100], -1 when the engine does not report one
 * @param rawPayload engine-specific record forwarded to the resolver
 * @param searchLink engine query URL that produced the hit
 */
public record SearchHit(
    SearchEngineName searchProvider,
    Platform platform,
    String platformId,
    double similarity,
    JsonNode rawPayload,
    String searchLink
) {

    public static final double SIMILARITY_NOT_REPORTED = -1.0;

    public SearchHit {
        Objects.requireNonNull(searchProvider, "searchProvider");
        Objects.requireNonNull(platformId, "platformId");
        platform = platform == null ? Platform.UNKNOWN : platform;
    }

    /**
     * Dedup and cache identifier, "{platform}:{platformId}" or "{searchProvider}:{platformId}" when unclassified
     */
    public String providerId() {
        if (platform.isKnown()) {
            return platform.getId() + ":" + platformId;
        }
        return searchProvider.getId() + ":" + platformId;
    }
}
