/**
 * e-shuushuu image metadata scraped from the image page
 *
 * @author William Callahan
 *
 * Features:
 * - Parses the image page with jsoup, there is no JSON API
 * - Reads the full resolution file and the Tags, Source, Characters and Artist lists
 * - Pages without a full resolution link are treated as missing posts
 */

package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.engine.SearchTransportException;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class EShuushuuProvider implements PlatformProvider {

    private static final Logger logger = LoggerFactory.getLogger(EShuushuuProvider.class);
    private static final String BASE_URL = "https://e-shuushuu.net";

    private final WebClient webClient;
    private final SearchConfigurationProperties properties;

    public EShuushuuProvider(WebClient searchWebClient, SearchConfigurationProperties properties) {
        this.webClient = searchWebClient;
        this.properties = properties;
    }

    @Override
    public Platform getPlatform() {
        return Platform.E_SHUUSHUU;
    }

    @Override
    @CircuitBreaker(name = "eshuushuu")
    @RateLimiter(name = "eshuushuu")
    public Mono<ProviderData> fetch(String platformId, JsonNode rawPayload) {
        String pageUrl = pageUrl(platformId);
        return webClient.get()
            .uri(UriComponentsBuilder.fromUriString(BASE_URL).path("/image/{id}/").encode().buildAndExpand(platformId).toUri())
            .header(HttpHeaders.USER_AGENT, properties.getBrowserUserAgent())
            .retrieve()
            .bodyToMono(String.class)
            .doOnSubscribe(subscription -> logger.debug("[eshuushuu:{}] fetching image page", platformId))
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
            .onErrorMap(WebClientException.class, e -> new SearchTransportException("eshuushuu", e.getMessage(), e))
            .flatMap(html -> Mono.justOrEmpty(toProviderData(platformId, pageUrl, html, rawPayload)));
    }

    static String pageUrl(String platformId) {
        return BASE_URL + "/image/" + platformId + "/";
    }

    Optional<ProviderData> toProviderData(String platformId, String pageUrl, String html, JsonNode rawPayload) {
        if (html == null || html.isBlank()) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html, BASE_URL);
        Element fullImage = document.selectFirst("a.thumb_image[href]");
        if (fullImage == null) {
            logger.debug("[eshuushuu:{}] no full resolution link on page", platformId);
            return Optional.empty();
        }

        Map<String, List<String>> lists = metadataLists(document);
        List<String> tags = lists.getOrDefault("tags", List.of());
        if (tags.isEmpty()) {
            logger.debug("[eshuushuu:{}] page has no tags", platformId);
        }

        return Optional.of(ProviderData.builder(getPlatform().getId(), getPlatform().getId() + ":" + platformId)
            .providerLink(pageUrl)
            .mainFile(fullImage.absUrl("href"))
            .field("authors", lists.getOrDefault("artist", List.of()))
            .field("characters", lists.getOrDefault("characters", List.of()))
            .field("tags", tags)
            .field("copyrights", lists.getOrDefault("source", List.of()))
            .extraLinks(ExtraLinkExtractor.extract(rawPayload))
            .build());
    }

    /**
     * Reads the "Label:" definition lists, keyed by lowercased label
     */
    private static Map<String, List<String>> metadataLists(Document document) {
        Map<String, List<String>> lists = new HashMap<>();
        for (Element term : document.select("dt")) {
            Element definition = term.nextElementSibling();
            if (definition == null || !"dd".equals(definition.tagName())) {
                continue;
            }
            List<String> values = new ArrayList<>();
            for (Element tag : definition.select("span.tag a")) {
                String value = tag.text().replace("\"", "").trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            }
            String label = term.text().replace(":", "").trim().toLowerCase();
            lists.merge(label, values, (existing, added) -> {
                List<String> merged = new ArrayList<>(existing);
                merged.addAll(added);
                return merged;
            });
        }
        return lists;
    }
}
