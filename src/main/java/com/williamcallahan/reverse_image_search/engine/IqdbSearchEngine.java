/**
 * IQDB reverse image search adapter
 * Only queries the e-shuushuu (6), zerochan (11) and 3dbooru (7) services; the
 * other boorus IQDB indexes are already covered by SauceNAO with better results
 *
 * @author William Callahan
 *
 * Features:
 * - Parses the IQDB result page with jsoup
 * - Reads best and additional matches with their size, rating and similarity
 * - Maps result hosts to platforms, unmapped hosts become unknown and keep their service in the id
 * - Circuit breaker guards the upstream
 */

package com.williamcallahan.reverse_image_search.engine;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import com.williamcallahan.reverse_image_search.util.UrlPatternMatcher;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class IqdbSearchEngine implements SearchEngine {

    private static final Logger logger = LoggerFactory.getLogger(IqdbSearchEngine.class);

    private static final List<Integer> SERVICES = List.of(6, 11, 7);
    private static final Set<String> MATCH_HEADINGS = Set.of("Best match", "Additional match");
    private static final Pattern SIZE_PATTERN = Pattern.compile("(\\d+)\\s*[×x]\\s*(\\d+)\\s*\\[(\\w+)]");
    private static final Pattern SIMILARITY_PATTERN = Pattern.compile("(\\d+(?:\\.\\d+)?)% similarity");
    private static final Pattern POST_ID_PATTERN = Pattern.compile("(\\d+)/?$");

    private final WebClient webClient;
    private final SearchConfigurationProperties properties;

    public IqdbSearchEngine(WebClient searchWebClient, SearchConfigurationProperties properties) {
        this.webClient = searchWebClient;
        this.properties = properties;
    }

    @Override
    public SearchEngineName getName() {
        return SearchEngineName.IQDB;
    }

    @Override
    @CircuitBreaker(name = "iqdb")
    public Flux<SearchHit> search(String imageUrl, String imageId) {
        URI requestUri = requestUri(imageUrl);
        String searchLink = requestUri.toString();

        return webClient.get()
            .uri(requestUri)
            .header(HttpHeaders.USER_AGENT, properties.getBrowserUserAgent())
            .retrieve()
            .bodyToMono(String.class)
            .doOnSubscribe(subscription -> logger.info("[{}] iqdb: starting search", imageId))
            .onErrorMap(WebClientException.class, e -> new SearchTransportException("iqdb", e.getMessage(), e))
            .flatMapIterable(html -> toHits(html, searchLink, imageId))
            .doOnComplete(() -> logger.info("[{}] iqdb: finished search", imageId));
    }

    private URI requestUri(String imageUrl) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(properties.getIqdb().getBaseUrl())
            .path("/")
            .queryParam("url", "{url}");
        for (Integer service : SERVICES) {
            builder.queryParam("service[]", service);
        }
        return builder.encode().buildAndExpand(imageUrl).toUri();
    }

    /**
     * Parses an IQDB result page into hits, skipping malformed match tables
     *
     * @param html result page
     * @param searchLink query URL recorded on each hit
     * @param imageId image identifier for log correlation
     * @return hits in page order
     */
    List<SearchHit> toHits(String html, String searchLink, String imageId) {
        Document document = Jsoup.parse(html, properties.getIqdb().getBaseUrl());
        List<SearchHit> hits = new ArrayList<>();
        for (Element match : document.select("#pages > div, div.pages > div")) {
            Element heading = match.selectFirst("th");
            if (heading == null || !MATCH_HEADINGS.contains(heading.text().trim())) {
                continue;
            }
            try {
                hits.add(toHit(match, searchLink));
            } catch (MalformedUpstreamRecordException e) {
                logger.warn("[{}] iqdb: skipping malformed match: {}", imageId, e.getMessage());
            }
        }
        if (hits.isEmpty() && html.contains("Best match")) {
            logger.debug("[{}] iqdb: 'Best match' present but nothing parsed, page layout changed?", imageId);
        }
        return hits;
    }

    private SearchHit toHit(Element match, String searchLink) {
        Element link = match.selectFirst("td.image a[href]");
        if (link == null) {
            throw new MalformedUpstreamRecordException("match has no post link");
        }
        String postLink = UrlPatternMatcher.absolutize(link.attr("href").trim());
        Matcher postIdMatcher = POST_ID_PATTERN.matcher(postLink);
        if (!postIdMatcher.find()) {
            throw new MalformedUpstreamRecordException("post link '" + postLink + "' has no numeric id");
        }
        String postId = postIdMatcher.group(1);
        long numericPostId;
        try {
            numericPostId = Long.parseLong(postId);
        } catch (NumberFormatException e) {
            throw new MalformedUpstreamRecordException("post id '" + postId + "' in " + postLink + " is out of range", e);
        }

        Element thumbnail = link.selectFirst("img");
        String thumbnailSrc = thumbnail == null ? null : thumbnail.absUrl("src");

        Element serviceCell = match.selectFirst("td:has(img.service-icon)");
        String service = serviceCell == null ? "" : serviceCell.text().trim();

        Matcher size = null;
        Matcher similarity = null;
        for (Element cell : match.select("td")) {
            String text = cell.text();
            Matcher sizeCandidate = SIZE_PATTERN.matcher(text);
            if (size == null && sizeCandidate.find()) {
                size = sizeCandidate;
            }
            Matcher similarityCandidate = SIMILARITY_PATTERN.matcher(text);
            if (similarity == null && similarityCandidate.find()) {
                similarity = similarityCandidate;
            }
        }
        if (size == null || similarity == null) {
            throw new MalformedUpstreamRecordException("match for " + postLink + " lacks size or similarity");
        }

        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("provider", service);
        payload.put("post_link", postLink);
        payload.put("post_id", numericPostId);
        payload.put("thumbnail_src", thumbnailSrc);
        payload.put("size", size.group(1) + "×" + size.group(2));
        payload.put("nsfw", !"safe".equalsIgnoreCase(size.group(3)));
        payload.put("search_link", searchLink);

        Platform platform = UrlPatternMatcher.platformForIqdbHost(postLink);
        String platformId = platform.isKnown() ? postId : serviceKey(service, postLink) + "-" + postId;
        return new SearchHit(SearchEngineName.IQDB, platform, platformId, Double.parseDouble(similarity.group(1)), payload, searchLink);
    }

    /**
     * Keeps post numbers from different unmapped services apart, e.g. "animepictures" for "Anime-Pictures"
     */
    static String serviceKey(String service, String postLink) {
        String key = service.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        if (!key.isEmpty()) {
            return key;
        }
        return UrlPatternMatcher.hostOf(postLink)
            .map(host -> host.replaceFirst("^www\\.", "").replaceAll("[^a-z0-9]", ""))
            .orElse("unknown");
    }
}
