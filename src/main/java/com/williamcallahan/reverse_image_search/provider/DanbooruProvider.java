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
 * Danbooru post metadata from the posts JSON API
 *
 * @author William Callahan
 */
@Service
public class DanbooruProvider extends AbstractBooruProvider {

    private static final String BASE_URL = "https://danbooru.donmai.us";

    public DanbooruProvider(WebClient searchWebClient, ObjectMapper objectMapper, SearchConfigurationProperties properties) {
        super(searchWebClient, objectMapper, properties);
    }

    @Override
    public Platform getPlatform() {
        return Platform.DANBOORU;
    }

    @Override
    @CircuitBreaker(name = "danbooru")
    @RateLimiter(name = "danbooru")
    public Mono<ProviderData> fetch(String platformId, JsonNode rawPayload) {
        return fetchPost(platformId, rawPayload);
    }

    @Override
    protected URI postApiUri(String platformId) {
        return UriComponentsBuilder.fromUriString(BASE_URL).path("/posts/{id}.json").encode().buildAndExpand(platformId).toUri();
    }

    @Override
    protected Optional<ProviderData> toProviderData(String platformId, JsonNode post, JsonNode rawPayload) {
        if (!post.isObject() || post.has("success") && !post.path("success").asBoolean(true)) {
            return Optional.empty();
        }
        return Optional.of(ProviderData.builder(getPlatform().getId(), getPlatform().getId() + ":" + platformId)
            .providerLink(BASE_URL + "/posts/" + platformId)
            .mainFile(firstText(post, "file_url", "large_file_url", "preview_file_url"))
            .field("authors", splitTags(post.get("tag_string_artist")))
            .field("characters", splitTags(post.get("tag_string_character")))
            .field("tags", splitTags(post.get("tag_string_general")))
            .field("copyrights", splitTags(post.get("tag_string_copyright")))
            .field("nsfw", isNsfwRating(post.get("rating")))
            .extraLinks(extraLinks(firstText(post, "source"), rawPayload))
            .build());
    }
}
