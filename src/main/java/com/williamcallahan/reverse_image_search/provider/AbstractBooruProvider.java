/**
 * Base class for providers that read a post from a booru-style JSON API
 *
 * @author William Callahan
 *
 * Features:
 * - One GET per post with the configured User-Agent
 * - 404 and empty bodies mean the post no longer exists
 * - Network failures and unreadable bodies surface as SearchTransportException
 * - Shared helpers for tag strings, ratings and extra links
 */

package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.engine.SearchTransportException;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.util.UrlPatternMatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

public abstract class AbstractBooruProvider implements PlatformProvider {

    protected final Logger logger = LoggerFactory.getLogger(getClass());

    protected final WebClient webClient;
    protected final ObjectMapper objectMapper;
    protected final SearchConfigurationProperties properties;

    protected AbstractBooruProvider(WebClient webClient, ObjectMapper objectMapper, SearchConfigurationProperties properties) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * API endpoint returning the post as JSON
     */
    protected abstract URI postApiUri(String platformId);

    /**
     * Maps the API body to a result
     *
     * @param platformId platform-local post id
     * @param body parsed API response
     * @param rawPayload engine record the hit came from
     * @return the result, empty when the body holds no post
     */
    protected abstract Optional<ProviderData> toProviderData(String platformId, JsonNode body, JsonNode rawPayload);

    protected String userAgent() {
        return properties.getDefaultUserAgent();
    }

    protected Mono<ProviderData> fetchPost(String platformId, JsonNode rawPayload) {
        String name = getPlatform().getId();
        return webClient.get()
            .uri(postApiUri(platformId))
            .header(HttpHeaders.USER_AGENT, userAgent())
            .retrieve()
            .bodyToMono(String.class)
            .doOnSubscribe(subscription -> logger.debug("[{}:{}] fetching post", name, platformId))
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                logger.debug("[{}:{}] post not found", name, platformId);
                return Mono.empty();
            })
            .onErrorMap(WebClientException.class, e -> new SearchTransportException(name, e.getMessage(), e))
            .flatMap(body -> {
                JsonNode json = parse(name, platformId, body);
                if (json.isMissingNode() || json.isNull() || json.isEmpty()) {
                    logger.debug("[{}:{}] no data", name, platformId);
                    return Mono.empty();
                }
                return Mono.justOrEmpty(toProviderData(platformId, json, rawPayload));
            });
    }

    private JsonNode parse(String name, String platformId, String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.missingNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new SearchTransportException(name, "unreadable response for post " + platformId + ": " + e.getOriginalMessage(), e);
        }
    }

    protected static List<String> splitTags(JsonNode node) {
        if (node == null || !node.isTextual()) {
            return List.of();
        }
        return Arrays.stream(node.asText().split(" "))
            .map(String::trim)
            .filter(tag -> !tag.isEmpty())
            .toList();
    }

    /**
     * Explicit and questionable ratings count as NSFW, whether spelled out or abbreviated
     */
    protected static boolean isNsfwRating(JsonNode rating) {
        String value = rating == null ? "" : rating.asText("").trim().toLowerCase();
        return value.startsWith("e") || value.startsWith("q");
    }

    protected static String firstText(JsonNode post, String... fieldNames) {
        for (String fieldName : fieldNames) {
            JsonNode value = post.get(fieldName);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return value.asText();
            }
        }
        return null;
    }

    /**
     * Post source link plus the links found in the engine record
     */
    protected static Set<String> extraLinks(String source, JsonNode rawPayload) {
        Set<String> links = new LinkedHashSet<>();
        if (UrlPatternMatcher.isWebUrl(source)) {
            links.add(source.trim());
        }
        links.addAll(ExtraLinkExtractor.extract(rawPayload));
        return links;
    }
}
