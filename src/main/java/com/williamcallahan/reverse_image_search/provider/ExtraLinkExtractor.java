package com.williamcallahan.reverse_image_search.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.williamcallahan.reverse_image_search.util.UrlPatternMatcher;

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Collects the related page links an engine record carries
 *
 * @author William Callahan
 */
public final class ExtraLinkExtractor {

    private ExtraLinkExtractor() {
        // Utility class
    }

    /**
     * Gathers the search link, external URLs and URL-valued fields of an engine record, thumbnails excluded
     * Legacy danbooru "post/show" links are rewritten to "posts"
     *
     * @param rawPayload SauceNAO record, IQDB match or any engine payload
     * @return links in discovery order, empty for non-object payloads
     */
    public static Set<String> extract(JsonNode rawPayload) {
        Set<String> links = new LinkedHashSet<>();
        if (rawPayload == null || !rawPayload.isObject()) {
            return links;
        }
        addIfUrl(links, rawPayload.path("search_link"));
        collectUrls(links, rawPayload);

        JsonNode data = rawPayload.path("data");
        if (data.isObject()) {
            for (JsonNode extUrl : data.path("ext_urls")) {
                addIfUrl(links, extUrl);
            }
            collectUrls(links, data);
        }

        Set<String> normalized = new LinkedHashSet<>();
        for (String link : links) {
            if (link.contains("danbooru.donmai.us") && link.contains("post/show/")) {
                normalized.add(link.replace("post/show/", "posts/"));
            } else {
                normalized.add(link);
            }
        }
        return normalized;
    }

    private static void collectUrls(Set<String> links, JsonNode node) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            // thumbnails are main files, not related pages
            if (!field.getKey().contains("thumbnail")) {
                addIfUrl(links, field.getValue());
            }
        }
    }

    private static void addIfUrl(Set<String> links, JsonNode value) {
        if (value != null && value.isTextual() && UrlPatternMatcher.isWebUrl(value.asText())) {
            links.add(value.asText().trim());
        }
    }
}
