/**
 * Builds results from the SauceNAO record alone
 * Used for platforms without a dedicated provider, or when the dedicated provider found nothing
 *
 * @author William Callahan
 *
 * Features:
 * - External URLs and URL-valued data fields become extra links
 * - Remaining non-empty data fields are kept as result fields
 * - The SauceNAO thumbnail is the main file, the search page the provider link
 */

package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import com.williamcallahan.reverse_image_search.util.UrlPatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
public class SauceNaoGenericProvider implements SearchEngineGenericProvider {

    private static final Logger logger = LoggerFactory.getLogger(SauceNaoGenericProvider.class);
    private static final Set<String> EMPTY_VALUES = Set.of("", "none", "null", "unknown");

    @Override
    public SearchEngineName getSearchEngine() {
        return SearchEngineName.SAUCENAO;
    }

    @Override
    public Mono<ProviderData> fetch(SearchHit hit) {
        return Mono.fromSupplier(() -> toProviderData(hit));
    }

    ProviderData toProviderData(SearchHit hit) {
        JsonNode record = hit.rawPayload();
        if (record == null || !record.path("data").isObject()) {
            logger.debug("[{}] saucenao generic: no data block", hit.providerId());
            return null;
        }
        JsonNode data = record.path("data");

        ProviderData.Builder builder = ProviderData.builder(GenericProvider.priorityKey(hit), hit.providerId())
            .providerLink(record.path("search_link").asText(hit.searchLink()))
            .mainFile(record.path("header").path("thumbnail").asText(null))
            .extraLinks(ExtraLinkExtractor.extract(record));

        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey();
            JsonNode value = field.getValue();
            if ("ext_urls".equals(name) || isEmpty(value)) {
                continue;
            }
            if (value.isBoolean()) {
                builder.field(name, value.asBoolean());
            } else if (value.isArray()) {
                List<String> values = new ArrayList<>();
                value.forEach(element -> {
                    if (!isEmpty(element)) {
                        values.add(element.asText());
                    }
                });
                builder.field(name, values);
            } else if (value.isValueNode() && !UrlPatternMatcher.isWebUrl(value.asText())) {
                builder.field(name, value.asText());
            }
        }
        return builder.build();
    }

    private static boolean isEmpty(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return true;
        }
        if (value.isArray()) {
            return value.isEmpty() || value.size() == 1 && EMPTY_VALUES.contains(value.get(0).asText().trim().toLowerCase());
        }
        return value.isValueNode() && !value.isBoolean() && EMPTY_VALUES.contains(value.asText().trim().toLowerCase());
    }
}
