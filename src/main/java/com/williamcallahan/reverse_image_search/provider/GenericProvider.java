package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Last-resort provider building a bare result from any engine payload
 *
 * @author William Callahan
 */
@Service
public class GenericProvider {

    /**
     * @return a result linking to the hit's search page, empty when the hit has no link at all
     */
    public Mono<ProviderData> fetch(SearchHit hit) {
        return Mono.fromSupplier(() -> toProviderData(hit));
    }

    /**
     * Platform name for classified hits, the platform-local id otherwise
     */
    static String priorityKey(SearchHit hit) {
        return hit.platform().isKnown() ? hit.platform().getId() : hit.platformId();
    }

    ProviderData toProviderData(SearchHit hit) {
        JsonNode payload = hit.rawPayload();
        Set<String> links = ExtraLinkExtractor.extract(payload);
        String link = hit.searchLink();
        if (link == null || link.isBlank()) {
            link = links.stream().findFirst().orElse(null);
        }
        if (link == null) {
            return null;
        }
        return ProviderData.builder(priorityKey(hit), hit.providerId())
            .providerLink(link)
            .extraLinks(links)
            .build();
    }
}
