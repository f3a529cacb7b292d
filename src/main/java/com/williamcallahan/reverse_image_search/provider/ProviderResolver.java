/**
 * Resolves a search hit into an enriched result through a fallback chain
 * The platform's own provider is tried first, then the generic provider of the
 * search engine that produced the hit, then the fully generic provider
 *
 * @author William Callahan
 *
 * Features:
 * - Each step only runs when the previous one completed empty
 * - Transport failures propagate instead of falling through, so they are never cached
 * - Resolution is cold: nothing is fetched until the result is subscribed
 */

package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

@Service
public class ProviderResolver {

    private static final Logger logger = LoggerFactory.getLogger(ProviderResolver.class);

    private final ProviderRegistry registry;

    public ProviderResolver(ProviderRegistry registry) {
        this.registry = registry;
    }

    /**
     * @param searchProvider engine that produced the hit
     * @param platform platform the hit was classified into
     * @param platformId platform-local id
     * @param rawPayload engine record
     * @return the result, empty when no provider could build one
     */
    public Mono<ProviderData> resolve(SearchEngineName searchProvider, Platform platform, String platformId, JsonNode rawPayload) {
        String searchLink = rawPayload == null ? null : rawPayload.path("search_link").asText(null);
        return resolve(new SearchHit(searchProvider, platform, platformId, SearchHit.SIMILARITY_NOT_REPORTED, rawPayload, searchLink));
    }

    public Mono<ProviderData> resolve(SearchHit hit) {
        String providerId = hit.providerId();

        Mono<ProviderData> specific = Mono.defer(() -> registry.forPlatform(hit.platform())
            .map(provider -> {
                logger.debug("[{}] trying provider '{}'", providerId, hit.platform().getId());
                return provider.fetch(hit.platformId(), hit.rawPayload())
                    .doOnSuccess(data -> {
                        if (data == null) {
                            logger.debug("[{}] provider '{}' returned nothing, trying generic provider", providerId, hit.platform().getId());
                        }
                    });
            })
            .orElseGet(Mono::empty));

        Mono<ProviderData> engineGeneric = Mono.defer(() -> registry.forSearchEngine(hit.searchProvider())
            .map(provider -> {
                logger.debug("[{}] using generic search provider '{}'", providerId, hit.searchProvider().getId());
                return provider.fetch(hit);
            })
            .orElseGet(Mono::empty));

        Mono<ProviderData> generic = Mono.defer(() -> {
            logger.debug("[{}] using generic provider", providerId);
            return registry.generic().fetch(hit);
        });

        return specific
            .switchIfEmpty(engineGeneric)
            .switchIfEmpty(generic)
            .doOnSuccess(data -> {
                if (data == null) {
                    logger.warn("[{}] no provider produced a result", providerId);
                }
            });
    }
}
