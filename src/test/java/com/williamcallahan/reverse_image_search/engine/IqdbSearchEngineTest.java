package com.williamcallahan.reverse_image_search.engine;

import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import com.williamcallahan.reverse_image_search.testutil.Fixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class IqdbSearchEngineTest {

    private static final String SEARCH_LINK = "https://iqdb.org/?url=https://example.com/a.jpg";

    private SearchConfigurationProperties properties;
    private IqdbSearchEngine engine;

    @BeforeEach
    void setUp() {
        properties = new SearchConfigurationProperties();
        engine = new IqdbSearchEngine(mock(WebClient.class), properties);
    }

    @Test
    void toHits_readsBestAndAdditionalMatches() {
        List<SearchHit> hits = engine.toHits(Fixtures.text("iqdb_response.html"), SEARCH_LINK, "img");

        assertEquals(List.of("zerochan:3456789", "3dbooru:654321", "eshuushuu:1024", "iqdb:animepictures-4242"),
            hits.stream().map(SearchHit::providerId).toList());
        assertEquals(List.of(94.0, 81.5, 72.0, 66.0), hits.stream().map(SearchHit::similarity).toList());
    }

    @Test
    void toHits_payloadCarriesMatchDetails() {
        SearchHit best = engine.toHits(Fixtures.text("iqdb_response.html"), SEARCH_LINK, "img").get(0);

        assertEquals(Platform.ZEROCHAN, best.platform());
        assertEquals("https://www.zerochan.net/3456789", best.rawPayload().path("post_link").asText());
        assertEquals(3456789L, best.rawPayload().path("post_id").asLong());
        assertEquals("https://iqdb.org/zerochan/1/2/3456789.jpg", best.rawPayload().path("thumbnail_src").asText());
        assertEquals("1200×1600", best.rawPayload().path("size").asText());
        assertEquals("Zerochan", best.rawPayload().path("provider").asText());
        assertFalse(best.rawPayload().path("nsfw").asBoolean());
        assertEquals(SEARCH_LINK, best.rawPayload().path("search_link").asText());
    }

    @Test
    void toHits_explicitRatingIsNsfw() {
        SearchHit additional = engine.toHits(Fixtures.text("iqdb_response.html"), SEARCH_LINK, "img").get(1);

        assertTrue(additional.rawPayload().path("nsfw").asBoolean());
    }

    @Test
    void toHits_postIdTooLargeIsSkipped() {
        List<SearchHit> hits = engine.toHits(Fixtures.text("iqdb_response.html"), SEARCH_LINK, "img");

        assertTrue(hits.stream().noneMatch(hit -> hit.rawPayload().path("post_link").asText().contains("99999999999999999999")));
        assertEquals(Platform.UNKNOWN, hits.get(3).platform());
    }

    @Test
    void toHits_unmappedServicesWithSamePostNumberStayDistinct() {
        String html = "<html><body><div id=\"pages\">"
            + match("Best match", "https://anime-pictures.net/posts/42", "Anime-Pictures", 90)
            + match("Additional match", "https://www.sakugabooru.com/post/show/42", "", 80)
            + "</div></body></html>";

        List<SearchHit> hits = engine.toHits(html, SEARCH_LINK, "img");

        assertEquals(List.of("iqdb:animepictures-42", "iqdb:sakugaboorucom-42"),
            hits.stream().map(SearchHit::providerId).toList());
        assertEquals(42L, hits.get(1).rawPayload().path("post_id").asLong());
    }

    private static String match(String heading, String link, String service, int similarity) {
        return "<div><table><tr><th>" + heading + "</th></tr>"
            + "<tr><td class=\"image\"><a href=\"" + link + "\"><img src=\"/t.jpg\" alt=\"\"></a></td></tr>"
            + "<tr><td><img class=\"service-icon\" src=\"/icon.ico\">" + service + "</td></tr>"
            + "<tr><td>500×500 [Safe]</td></tr>"
            + "<tr><td>" + similarity + "% similarity</td></tr></table></div>";
    }

    @Test
    void toHits_noMatchesPage() {
        String html = "<html><body><div id=\"pages\"><div><table><tr><th>Your image</th></tr></table></div>"
            + "<div><table><tr><th>No relevant matches</th></tr></table></div></div></body></html>";

        assertTrue(engine.toHits(html, SEARCH_LINK, "img").isEmpty());
    }

    @Test
    void search_sendsBrowserUserAgentAndServices() {
        Fixtures.StubHttp http = new Fixtures.StubHttp(HttpStatus.OK, MediaType.TEXT_HTML, Fixtures.text("iqdb_response.html"));
        engine = new IqdbSearchEngine(http.webClient(), properties);

        StepVerifier.create(engine.search("https://example.com/a.jpg", "img"))
            .expectNextCount(4)
            .verifyComplete();

        String query = http.requests().get(0).url().getRawQuery();
        assertTrue(query.contains("service%5B%5D=6") || query.contains("service[]=6"));
        assertEquals(properties.getBrowserUserAgent(), http.requests().get(0).headers().getFirst("User-Agent"));
    }

    @Test
    void search_serverErrorIsTransportError() {
        Fixtures.StubHttp http = new Fixtures.StubHttp(HttpStatus.SERVICE_UNAVAILABLE, MediaType.TEXT_HTML, "down");
        engine = new IqdbSearchEngine(http.webClient(), properties);

        StepVerifier.create(engine.search("https://example.com/a.jpg", "img"))
            .expectError(SearchTransportException.class)
            .verify();
    }
}
