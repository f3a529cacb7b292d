package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Builds results from an IQDB match alone: its post link, thumbnail, size and rating
 *
 * @author William Callahan
 */
@Service
public class IqdbGenericProvider implements SearchEngineGenericProvider {

    @Override
    public SearchEngineName getSearchEngine() {
        return SearchEngineName.IQDB;
    }

    @Override
    public Mono<ProviderData> fetch(SearchHit hit) {
        return Mono.fromSupplier(() -> toProviderData(hit));
    }

    ProviderData toProviderData(SearchHit hit) {
        JsonNode match = hit.rawPayload();
        if (match == null || !match.hasNonNull("post_link")) {
            return null;
        }
        ProviderData.Builder builder = ProviderData.builder(GenericProvider.priorityKey(hit), hit.providerId())
            .providerLink(match.path("post_link").asText())
            .mainFile(match.path("thumbnail_src").asText(null))
            .field("size", match.path("size").asText(null))
            .field("service", match.path("provider").asText(null))
            .extraLinks(ExtraLinkExtractor.extract(match));
        if (match.has("nsfw")) {
            builder.field("nsfw", match.path("nsfw").asBoolean());
        }
        return builder.build();
    }
}
