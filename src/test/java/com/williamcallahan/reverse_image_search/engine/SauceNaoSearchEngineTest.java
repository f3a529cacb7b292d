package com.williamcallahan.reverse_image_search.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import com.williamcallahan.reverse_image_search.testutil.Fixtures;
import com.williamcallahan.reverse_image_search.util.HashUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.net.URI;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class SauceNaoSearchEngineTest {

    private static final String SEARCH_LINK = "https://saucenao.com/search.php?url=https://example.com/a.jpg";

    private SearchConfigurationProperties properties;
    private SauceNaoSearchEngine engine;

    @BeforeEach
    void setUp() {
        properties = new SearchConfigurationProperties();
        engine = new SauceNaoSearchEngine(mock(WebClient.class), properties);
    }

    @Test
    void toHits_classifiesEveryRecord() {
        List<SearchHit> hits = engine.toHits(Fixtures.json("saucenao_response.json"), SEARCH_LINK, "img");

        assertEquals(List.of(
            "danbooru:555",
            "gelbooru:777",
            "pixiv:123456",
            "twitter:1234567890",
            "patreon:999",
            "saucenao:" + HashUtils.sha1Hex("Index #21: Anime - episode_03.mkv")
        ), hits.stream().map(SearchHit::providerId).toList());
    }

    @Test
    void toHits_multipleIdFieldsShareOnePayload() {
        List<SearchHit> hits = engine.toHits(Fixtures.json("saucenao_response.json"), SEARCH_LINK, "img");

        SearchHit danbooru = hits.get(0);
        SearchHit gelbooru = hits.get(1);
        assertEquals(92.51, danbooru.similarity(), 0.001);
        assertSame(danbooru.rawPayload(), gelbooru.rawPayload());
        assertEquals(SEARCH_LINK, danbooru.rawPayload().path("search_link").asText());
        assertEquals(SearchEngineName.SAUCENAO, danbooru.searchProvider());
        assertEquals(SEARCH_LINK, danbooru.searchLink());
    }

    @Test
    void toHits_patreonIdOnlyForItsIndex() {
        JsonNode body = Fixtures.parse("""
            {"header": {"status": 0}, "results": [
              {"header": {"similarity": "90", "index_id": 38, "index_name": "Index #38: H-Misc - x"},
               "data": {"id": "31", "ext_urls": []}}
            ]}
            """);

        List<SearchHit> hits = engine.toHits(body, SEARCH_LINK, "img");

        assertEquals(1, hits.size());
        assertEquals(Platform.UNKNOWN, hits.get(0).platform());
    }

    @Test
    void toHits_respectsConfiguredMinimumSimilarity() {
        properties.getSaucenao().setMinSimilarity(90.0);

        List<SearchHit> hits = engine.toHits(Fixtures.json("saucenao_response.json"), SEARCH_LINK, "img");

        assertEquals(List.of(Platform.DANBOORU, Platform.GELBOORU), hits.stream().map(SearchHit::platform).toList());
    }

    @Test
    void toHits_errorStatusWithoutResultsIsTransportError() {
        JsonNode body = Fixtures.parse("{\"header\": {\"status\": -2, \"message\": \"Search Rate Too High.\"}}");

        SearchTransportException e = assertThrows(SearchTransportException.class,
            () -> engine.toHits(body, SEARCH_LINK, "img"));
        assertEquals("saucenao", e.getUpstream());
    }

    @Test
    void toHits_emptyResponseIsNoHits() {
        assertTrue(engine.toHits(Fixtures.parse("{\"header\": {\"status\": 0}}"), SEARCH_LINK, "img").isEmpty());
    }

    @Test
    void search_queriesApiWithKeyButKeepsItOutOfSearchLink() {
        properties.getSaucenao().setApiKey("secret-key");
        Fixtures.StubHttp http = new Fixtures.StubHttp(HttpStatus.OK, MediaType.APPLICATION_JSON, Fixtures.text("saucenao_response.json"));
        engine = new SauceNaoSearchEngine(http.webClient(), properties);

        StepVerifier.create(engine.search("https://example.com/a.jpg", "img"))
            .assertNext(hit -> {
                assertEquals("danbooru:555", hit.providerId());
                assertFalse(hit.searchLink().contains("secret-key"));
            })
            .expectNextCount(5)
            .verifyComplete();

        URI requested = http.requests().get(0).url();
        assertTrue(requested.getQuery().contains("api_key=secret-key"));
        assertTrue(requested.getQuery().contains("output_type=2"));
        assertEquals("reverse_image_search_bot/3.0", http.requests().get(0).headers().getFirst(HttpHeaders.USER_AGENT));
    }

    @Test
    void search_httpFailureIsTransportError() {
        Fixtures.StubHttp http = new Fixtures.StubHttp(HttpStatus.TOO_MANY_REQUESTS, MediaType.APPLICATION_JSON, "{}");
        engine = new SauceNaoSearchEngine(http.webClient(), properties);

        StepVerifier.create(engine.search("https://example.com/a.jpg", "img"))
            .expectError(SearchTransportException.class)
            .verify();
    }
}
