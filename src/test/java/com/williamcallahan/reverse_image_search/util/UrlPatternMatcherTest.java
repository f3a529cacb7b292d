package com.williamcallahan.reverse_image_search.util;

import com.williamcallahan.reverse_image_search.model.Platform;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for UrlPatternMatcher post and host recognition.
 */
class UrlPatternMatcherTest {

    @ParameterizedTest
    @CsvSource({
        "https://danbooru.donmai.us/posts/555, DANBOORU, 555",
        "https://danbooru.donmai.us/post/show/556, DANBOORU, 556",
        "https://gelbooru.com/index.php?page=post&s=view&id=777, GELBOORU, 777",
        "https://yande.re/post/show/12, YANDERE, 12",
        "https://konachan.com/post/show/34, KONACHAN, 34",
        "https://www.zerochan.net/3456789, ZEROCHAN, 3456789",
        "http://behoimi.org/post/show/654321, THREE_D_BOORU, 654321",
        "https://e-shuushuu.net/image/1024/, E_SHUUSHUU, 1024",
        "https://www.pixiv.net/artworks/123456, PIXIV, 123456",
        "https://www.pixiv.net/member_illust.php?mode=medium&illust_id=42, PIXIV, 42",
        "https://twitter.com/artist/status/1234567890, TWITTER, 1234567890",
        "https://x.com/artist/status/99, TWITTER, 99"
    })
    void identifyPost_knownPlatforms(String url, Platform platform, String postId) {
        assertEquals(Optional.of(new UrlPatternMatcher.PostReference(platform, postId)), UrlPatternMatcher.identifyPost(url));
    }

    @Test
    void identifyPost_unknownUrls() {
        assertTrue(UrlPatternMatcher.identifyPost("https://example.org/anime/title").isEmpty());
        assertTrue(UrlPatternMatcher.identifyPost("").isEmpty());
        assertTrue(UrlPatternMatcher.identifyPost(null).isEmpty());
    }

    @Test
    void platformForIqdbHost_mapsQueriedServices() {
        assertEquals(Platform.ZEROCHAN, UrlPatternMatcher.platformForIqdbHost("//www.zerochan.net/1"));
        assertEquals(Platform.THREE_D_BOORU, UrlPatternMatcher.platformForIqdbHost("http://behoimi.org/post/show/1"));
        assertEquals(Platform.E_SHUUSHUU, UrlPatternMatcher.platformForIqdbHost("https://e-shuushuu.net/image/1/"));
        assertEquals(Platform.UNKNOWN, UrlPatternMatcher.platformForIqdbHost("https://anime-pictures.net/posts/1"));
        assertEquals(Platform.UNKNOWN, UrlPatternMatcher.platformForIqdbHost("not a url"));
    }

    @Test
    void isWebUrl_requiresHttpSchemeAndHost() {
        assertTrue(UrlPatternMatcher.isWebUrl("https://example.com/a"));
        assertFalse(UrlPatternMatcher.isWebUrl("ftp://example.com/a"));
        assertFalse(UrlPatternMatcher.isWebUrl("Some Anime"));
        assertFalse(UrlPatternMatcher.isWebUrl(null));
    }

    @Test
    void absolutize_protocolRelativeLinks() {
        assertEquals("https://iqdb.org/x.jpg", UrlPatternMatcher.absolutize("//iqdb.org/x.jpg"));
        assertEquals("/relative", UrlPatternMatcher.absolutize("/relative"));
    }
}
