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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Zerochan entry metadata; the JSON view is served with an HTML content type and needs a browser User-Agent
 *
 * @author William Callahan
 */
@Service
public class ZerochanProvider extends AbstractBooruProvider {

    private static final String BASE_URL = "https://www.zerochan.net";

    public ZerochanProvider(WebClient searchWebClient, ObjectMapper objectMapper, SearchConfigurationProperties properties) {
        super(searchWebClient, objectMapper, properties);
    }

    @Override
    public Platform getPlatform() {
        return Platform.ZEROCHAN;
    }

    @Override
    @CircuitBreaker(name = "zerochan")
    @RateLimiter(name = "zerochan")
    public Mono<ProviderData> fetch(String platformId, JsonNode rawPayload) {
        return fetchPost(platformId, rawPayload);
    }

    @Override
    protected String userAgent() {
        return properties.getBrowserUserAgent();
    }

    @Override
    protected URI postApiUri(String platformId) {
        return UriComponentsBuilder.fromUriString(BASE_URL).path("/{id}").query("json").encode().buildAndExpand(platformId).toUri();
    }

    @Override
    protected Optional<ProviderData> toProviderData(String platformId, JsonNode entry, JsonNode rawPayload) {
        if (!entry.isObject()) {
            return Optional.empty();
        }
        List<String> tags = new ArrayList<>();
        for (JsonNode tag : entry.path("tags")) {
            if (tag.isTextual() && !tag.asText().isBlank()) {
                tags.add(tag.asText());
            }
        }
        return Optional.of(ProviderData.builder(getPlatform().getId(), getPlatform().getId() + ":" + platformId)
            .providerLink(BASE_URL + "/" + platformId)
            .mainFile(firstText(entry, "full", "large", "medium", "small"))
            .field("tags", tags)
            .field("nsfw", false)
            .extraLinks(extraLinks(firstText(entry, "source"), rawPayload))
            .build());
    }
}
