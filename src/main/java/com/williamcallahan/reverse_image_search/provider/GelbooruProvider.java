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
 * Gelbooru post metadata from the dapi JSON endpoint
 *
 * @author William Callahan
 */
@Service
public class GelbooruProvider extends AbstractBooruProvider {

    private static final String BASE_URL = "https://gelbooru.com";

    public GelbooruProvider(WebClient searchWebClient, ObjectMapper objectMapper, SearchConfigurationProperties properties) {
        super(searchWebClient, objectMapper, properties);
    }

    @Override
    public Platform getPlatform() {
        return Platform.GELBOORU;
    }

    @Override
    @CircuitBreaker(name = "gelbooru")
    @RateLimiter(name = "gelbooru")
    public Mono<ProviderData> fetch(String platformId, JsonNode rawPayload) {
        return fetchPost(platformId, rawPayload);
    }

    @Override
    protected URI postApiUri(String platformId) {
        return UriComponentsBuilder.fromUriString(BASE_URL)
            .path("/index.php")
            .queryParam("page", "dapi")
            .queryParam("s", "post")
            .queryParam("q", "index")
            .queryParam("json", 1)
            .queryParam("id", "{id}")
            .encode()
            .buildAndExpand(platformId)
            .toUri();
    }

    @Override
    protected Optional<ProviderData> toProviderData(String platformId, JsonNode body, JsonNode rawPayload) {
        JsonNode posts = body.path("post");
        if (!posts.isArray() || posts.isEmpty()) {
            return Optional.empty();
        }
        JsonNode post = posts.get(0);
        return Optional.of(ProviderData.builder(getPlatform().getId(), getPlatform().getId() + ":" + platformId)
            .providerLink(BASE_URL + "/index.php?page=post&s=view&id=" + platformId)
            .mainFile(firstText(post, "file_url", "sample_url", "preview_url"))
            .field("tags", splitTags(post.get("tags")))
            .field("nsfw", isNsfwRating(post.get("rating")))
            .extraLinks(extraLinks(firstText(post, "source"), rawPayload))
            .build());
    }
}
