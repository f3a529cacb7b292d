package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import reactor.core.publisher.Mono;

/**
 * Fetches full post metadata from one source platform
 *
 * @author William Callahan
 */
public interface PlatformProvider {

    Platform getPlatform();

    /**
     * @param platformId platform-local post id
     * @param rawPayload engine record the hit came from, mined for extra links
     * @return the enriched record, empty when the platform has no such post
     */
    Mono<ProviderData> fetch(String platformId, JsonNode rawPayload);
}
