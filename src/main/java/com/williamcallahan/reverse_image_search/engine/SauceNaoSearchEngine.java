/**
 * SauceNAO reverse image search adapter
 *
 * @author William Callahan
 *
 * Features:
 * - Queries the JSON API across every SauceNAO index with the optional API key
 * - Drops results below the configured minimum similarity
 * - Classifies results through the index id fields SauceNAO returns
 * - Falls back to the result's external URLs, then to an index-scoped unknown id
 * - A record matching several id fields yields one hit per field
 * - Circuit breaker and rate limiter guard the upstream
 */

package com.williamcallahan.reverse_image_search.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import com.williamcallahan.reverse_image_search.util.HashUtils;
import com.williamcallahan.reverse_image_search.util.UrlPatternMatcher;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class SauceNaoSearchEngine implements SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(SauceNaoSearchEngine.class);

    /**
     * Data field holding a platform id, optionally only valid for one SauceNAO index
     */
    record IdField(String key, Platform platform, Integer indexId) {
    }

    /** Checked in order; the patreon id field is the generic "id" and only counts for index 43 */
    static final List<IdField> ID_FIELDS = List.of(
        new IdField("danbooru_id", Platform.DANBOORU, null),
        new IdField("yandere_id", Platform.YANDERE, null),
        new IdField("gelbooru_id", Platform.GELBOORU, null),
        new IdField("konachan_id", Platform.KONACHAN, null),
        new IdField("sankaku_id", Platform.SANKAKU, null),
        new IdField("pixiv_id", Platform.PIXIV, null),
        new IdField("md_id", Platform.MANGADEX, null),
        new IdField("mu_id", Platform.MANGAUPDATES, null),
        new IdField("mal_id", Platform.MYANIMELIST, null),
        new IdField("da_id", Platform.DEVIANTART, null),
        new IdField("as_project", Platform.ARTSTATION, null),
        new IdField("id", Platform.PATREON, 43),
        new IdField("anidb_aid", Platform.ANIDB, null),
        new IdField("anilist_id", Platform.ANILIST, null),
        new IdField("tweet_id", Platform.TWITTER, null),
        new IdField("imdb_id", Platform.IMDB, null),
        new IdField("e621_id", Platform.E621, null)
    );

    private final WebClient webClient;
    private final SearchConfigurationProperties properties;

    public SauceNaoSearchEngine(WebClient searchWebClient, SearchConfigurationProperties properties) {
        this.webClient = searchWebClient;
        this.properties = properties;
    }

    @Override
    public SearchEngineName getName() {
        return SearchEngineName.SAUCENAO;
    }

    @Override
    @CircuitBreaker(name = "saucenao")
    @RateLimiter(name = "saucenao")
    public Flux<SearchHit> search(String imageUrl, String imageId) {
        String searchLink = searchLink(imageUrl);
        URI requestUri = requestUri(imageUrl);
        String apiKey = properties.getSaucenao().getApiKey();

        return webClient.get()
            .uri(requestUri)
            .header(HttpHeaders.USER_AGENT, properties.getDefaultUserAgent())
            .retrieve()
            .bodyToMono(JsonNode.class)
            .doOnSubscribe(subscription -> logger.info("[{}] saucenao: starting search ({} api key)", imageId,
                apiKey == null || apiKey.isBlank() ? "without" : "with"))
            .onErrorMap(e -> e instanceof WebClientException || e instanceof CodecException,
                e -> new SearchTransportException("saucenao", e.getMessage(), e))
            .flatMapIterable(body -> toHits(body, searchLink, imageId))
            .doOnComplete(() -> logger.info("[{}] saucenao: finished search", imageId));
    }

    /**
     * Public search page for an image, without credentials
     */
    String searchLink(String imageUrl) {
        return UriComponentsBuilder.fromUriString(properties.getSaucenao().getBaseUrl())
            .path("/search.php")
            .queryParam("url", "{url}")
            .encode()
            .buildAndExpand(imageUrl)
            .toUriString();
    }

    private URI requestUri(String imageUrl) {
        Map<String, Object> variables = new HashMap<>();
        variables.put("url", imageUrl);
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getSaucenao().getBaseUrl())
            .path("/search.php")
            .queryParam("url", "{url}")
            .queryParam("output_type", 2)
            .queryParam("db", 999)
            .queryParam("testmode", 1);
        String apiKey = properties.getSaucenao().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.queryParam("api_key", "{apiKey}");
            variables.put("apiKey", apiKey);
        }
        return builder.encode().buildAndExpand(variables).toUri();
    }

    /**
     * Converts a SauceNAO response body into hits, skipping malformed records
     *
     * @param body parsed JSON response
     * @param searchLink public search page recorded on each hit
     * @param imageId image identifier for log correlation
     * @return hits in response order
     */
    List<SearchHit> toHits(JsonNode body, String searchLink, String imageId) {
        JsonNode results = body.path("results");
        if (!results.isArray()) {
            int status = body.path("header").path("status").asInt(0);
            if (status != 0) {
                throw new SearchTransportException("saucenao",
                    "status " + status + ": " + body.path("header").path("message").asText(""), null);
            }
            logger.debug("[{}] saucenao: response has no results", imageId);
            return List.of();
        }

        double minSimilarity = properties.getSaucenao().getMinSimilarity();
        List<SearchHit> hits = new ArrayList<>();
        for (JsonNode record : results) {
            try {
                hits.addAll(toHitsForRecord(record, searchLink, minSimilarity, imageId));
            } catch (MalformedUpstreamRecordException e) {
                logger.warn("[{}] saucenao: skipping malformed record: {}", imageId, e.getMessage());
            }
        }
        return hits;
    }

    private List<SearchHit> toHitsForRecord(JsonNode record, String searchLink, double minSimilarity, String imageId) {
        JsonNode header = record.path("header");
        JsonNode data = record.path("data");
        if (!header.isObject() || !data.isObject()) {
            throw new MalformedUpstreamRecordException("record lacks header or data");
        }

        double similarity = parseSimilarity(header.path("similarity"));
        if (similarity < minSimilarity) {
            return List.of();
        }

        ObjectNode payload = record.deepCopy();
        payload.put("search_link", searchLink);

        int indexId = header.path("index_id").asInt(-1);
        List<SearchHit> hits = new ArrayList<>();
        for (IdField field : ID_FIELDS) {
            if (field.indexId() != null && field.indexId() != indexId) {
                continue;
            }
            Optional<String> id = idValue(data.get(field.key()));
            if (id.isPresent()) {
                logger.debug("[{}] saucenao: found known provider result provider='{}' {}='{}'",
                    imageId, field.platform().getId(), field.key(), id.get());
                hits.add(new SearchHit(SearchEngineName.SAUCENAO, field.platform(), id.get(), similarity, payload, searchLink));
            }
        }
        if (!hits.isEmpty()) {
            return hits;
        }

        for (JsonNode extUrl : data.path("ext_urls")) {
            Optional<UrlPatternMatcher.PostReference> post = UrlPatternMatcher.identifyPost(extUrl.asText());
            if (post.isPresent()) {
                logger.debug("[{}] saucenao: classified result by url provider='{}'", imageId, post.get().platform().getId());
                return List.of(new SearchHit(SearchEngineName.SAUCENAO, post.get().platform(), post.get().postId(),
                    similarity, payload, searchLink));
            }
        }

        String indexName = header.path("index_name").asText("");
        if (indexName.isBlank()) {
            throw new MalformedUpstreamRecordException("unclassified record without index_name");
        }
        logger.debug("[{}] saucenao: found unknown provider result index='{}'", imageId, indexName);
        return List.of(new SearchHit(SearchEngineName.SAUCENAO, Platform.UNKNOWN, HashUtils.sha1Hex(indexName),
            similarity, payload, searchLink));
    }

    private static double parseSimilarity(JsonNode node) {
        if (node.isNumber()) {
            return node.asDouble();
        }
        try {
            return Double.parseDouble(node.asText());
        } catch (NumberFormatException e) {
            throw new MalformedUpstreamRecordException("similarity '" + node.asText() + "' is not a number", e);
        }
    }

    /**
     * Id field value as text; numbers keep their integral form, arrays use their first entry
     */
    private static Optional<String> idValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node.isArray()) {
            return node.isEmpty() ? Optional.empty() : idValue(node.get(0));
        }
        if (node.isIntegralNumber()) {
            return Optional.of(node.bigIntegerValue().toString());
        }
        String text = node.asText().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }
}
