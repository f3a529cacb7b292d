package com.williamcallahan.reverse_image_search.util;

import com.williamcallahan.reverse_image_search.model.Platform;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility for identifying the platform and post id behind a source URL.
 * Centralizes URL pattern matching used by the search engine adapters.
 */
public final class UrlPatternMatcher {

    /** Post URL patterns, first capture group is the platform-local id */
    private static final Map<Platform, Pattern> POST_PATTERNS = new LinkedHashMap<>();

    static {
        POST_PATTERNS.put(Platform.ZEROCHAN, Pattern.compile("(?i)^https?://(?:www\\.)?zerochan\\.net/(\\d+)"));
        POST_PATTERNS.put(Platform.E_SHUUSHUU, Pattern.compile("(?i)^https?://(?:www\\.)?e-shuushuu\\.net/image/(\\d+)"));
        POST_PATTERNS.put(Platform.THREE_D_BOORU, Pattern.compile("(?i)^https?://behoimi\\.org/post/show/(\\d+)"));
        POST_PATTERNS.put(Platform.DANBOORU, Pattern.compile("(?i)^https?://danbooru\\.donmai\\.us/(?:posts|post/show)/(\\d+)"));
        POST_PATTERNS.put(Platform.GELBOORU, Pattern.compile("(?i)^https?://(?:www\\.)?gelbooru\\.com/index\\.php\\?(?:.*&)?id=(\\d+)"));
        POST_PATTERNS.put(Platform.YANDERE, Pattern.compile("(?i)^https?://yande\\.re/post/show/(\\d+)"));
        POST_PATTERNS.put(Platform.KONACHAN, Pattern.compile("(?i)^https?://konachan\\.(?:com|net)/post/show/(\\d+)"));
        POST_PATTERNS.put(Platform.PIXIV, Pattern.compile(
            "(?i)^https?://(?:www\\.)?pixiv\\.net/(?:(?:en/)?artworks/|member_illust\\.php\\?(?:.*&)?illust_id=)(\\d+)"));
        POST_PATTERNS.put(Platform.TWITTER, Pattern.compile("(?i)^https?://(?:www\\.|mobile\\.)?(?:twitter|x)\\.com/[^/]+/status/(\\d+)"));
    }

    /** Hosts IQDB links to, for the services it is queried with */
    private static final Map<String, Platform> IQDB_HOSTS = Map.of(
        "www.zerochan.net", Platform.ZEROCHAN,
        "zerochan.net", Platform.ZEROCHAN,
        "behoimi.org", Platform.THREE_D_BOORU,
        "e-shuushuu.net", Platform.E_SHUUSHUU
    );

    private UrlPatternMatcher() {
        // Utility class
    }

    /**
     * Platform and id recognized in a post URL
     */
    public record PostReference(Platform platform, String postId) {
    }

    /**
     * Identifies the platform post a URL points at
     *
     * @param url the URL to analyze
     * @return the recognized post, empty when no known pattern matches
     */
    public static Optional<PostReference> identifyPost(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        String trimmed = url.trim();
        for (Map.Entry<Platform, Pattern> entry : POST_PATTERNS.entrySet()) {
            Matcher matcher = entry.getValue().matcher(trimmed);
            if (matcher.find()) {
                return Optional.of(new PostReference(entry.getKey(), matcher.group(1)));
            }
        }
        return Optional.empty();
    }

    /**
     * Maps the host of an IQDB result link to its platform
     *
     * @param url absolute or protocol-relative link
     * @return the platform, {@link Platform#UNKNOWN} for unmapped or unparsable hosts
     */
    public static Platform platformForIqdbHost(String url) {
        return hostOf(url).map(host -> IQDB_HOSTS.getOrDefault(host, Platform.UNKNOWN)).orElse(Platform.UNKNOWN);
    }

    /**
     * Checks if a value is an absolute http(s) URL with a host
     */
    public static boolean isWebUrl(String value) {
        if (value == null || value.isBlank()) {
            return false;
        }
        String lower = value.trim().toLowerCase();
        return (lower.startsWith("http://") || lower.startsWith("https://")) && hostOf(value).isPresent();
    }

    /**
     * Adds https: to protocol-relative links
     */
    public static String absolutize(String url) {
        if (url != null && url.startsWith("//")) {
            return "https:" + url;
        }
        return url;
    }

    /**
     * Lower-cased host of a URL, empty when it has none or does not parse
     */
    public static Optional<String> hostOf(String url) {
        if (url == null || url.isBlank()) {
            return Optional.empty();
        }
        try {
            String host = URI.create(absolutize(url.trim())).getHost();
            return Optional.ofNullable(host).map(String::toLowerCase);
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
