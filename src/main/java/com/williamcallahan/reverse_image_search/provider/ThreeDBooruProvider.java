package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.Optional;

/**
 * 3dbooru (behoimi.org) post metadata
 *
 * @author William Callahan
 */
@Service
public class ThreeDBooruProvider extends AbstractBooruProvider {

    private static final String BASE_URL = "http://behoimi.org";

    public ThreeDBooruProvider(WebClient searchWebClient, ObjectMapper objectMapper, SearchConfigurationProperties properties) {
        super(searchWebClient, objectMapper, properties);
    }

    @Override
    public Platform getPlatform() {
        return Platform.THREE_D_BOORU;
    }

    @Override
    @CircuitBreaker(name = "3dbooru")
    @RateLimiter(name = "3dbooru")
    public Mono<ProviderData> fetch(String platformId, JsonNode rawPayload) {
        return fetchPost(platformId, rawPayload);
    }

    @Override
    protected String userAgent() {
        return properties.getBrowserUserAgent();
    }

    @Override
    protected URI postApiUri(String platformId) {
        return UriComponentsBuilder.fromUriString(BASE_URL)
            .path("/post/index.json")
            .queryParam("tags", "id:{id}")
            .encode()
            .buildAndExpand(platformId)
            .toUri();
    }

    @Override
    protected Optional<ProviderData> toProviderData(String platformId, JsonNode body, JsonNode rawPayload) {
        if (!body.isArray() || body.isEmpty() || !body.get(0).isObject() || body.get(0).isEmpty()) {
            return Optional.empty();
        }
        JsonNode post = body.get(0);
        // file_url and sample_url serve placeholder images to non-browser clients
        return Optional.of(ProviderData.builder(getPlatform().getId(), getPlatform().getId() + ":" + platformId)
            .providerLink(BASE_URL + "/post/show/" + platformId)
            .mainFile(firstText(post, "preview_url"))
            .field("tags", splitTags(post.get("tags")))
            .field("nsfw", isNsfwRating(post.get("rating")))
            .extraLinks(extraLinks(firstText(post, "source"), rawPayload))
            .build());
    }
}
