/**
 * Spring Shell CLI commands for running searches and maintaining the search cache
 *
 * @author William Callahan
 *
 * Features:
 * - Runs a reverse image search for a URL with a user's stored settings
 * - Reports cache entry counts and search counters
 * - Clears the negative cache or the whole provider result cache
 */

package com.williamcallahan.reverse_image_search.cli;

import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.UserSettings;
import com.williamcallahan.reverse_image_search.search.SearchCoordinator;
import com.williamcallahan.reverse_image_search.service.CacheStats;
import com.williamcallahan.reverse_image_search.service.SearchCacheService;
import com.williamcallahan.reverse_image_search.service.UserSettingsRepository;
import com.williamcallahan.reverse_image_search.util.HashUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ShellComponent
public class SearchCommands {

    private static final Logger logger = LoggerFactory.getLogger(SearchCommands.class);

    private final SearchCoordinator searchCoordinator;
    private final SearchCacheService cacheService;
    private final UserSettingsRepository settingsRepository;
    private final SearchConfigurationProperties properties;

    public SearchCommands(SearchCoordinator searchCoordinator,
                          SearchCacheService cacheService,
                          UserSettingsRepository settingsRepository,
                          SearchConfigurationProperties properties) {
        this.searchCoordinator = searchCoordinator;
        this.cacheService = cacheService;
        this.settingsRepository = settingsRepository;
        this.properties = properties;
    }

    /**
     * Searches for the sources of an image and prints one block per result
     *
     * @param url publicly reachable image URL
     * @param imageId image identifier; defaults to the SHA-256 of the URL
     * @param userId user whose settings apply
     * @return formatted results
     */
    @ShellMethod(value = "Reverse search an image URL across the enabled search engines", key = "ris search")
    public String search(
        @ShellOption(help = "Image URL") String url,
        @ShellOption(defaultValue = ShellOption.NULL, help = "Image id, defaults to the SHA-256 of the URL") String imageId,
        @ShellOption(defaultValue = "0", help = "User whose settings are used") long userId
    ) {
        String id = imageId == null || imageId.isBlank()
            ? HashUtils.sha256Hex(url)
            : imageId;
        try {
            UserSettings settings = settingsRepository.fetch(userId);
            long userSearches = cacheService.incrUserSearchCount(userId);
            logger.debug("User {} has searched {} times", userId, userSearches);

            List<ProviderData> results = searchCoordinator.search(url, id, settings)
                .collectList()
                .block(properties.getSearchTimeout());
            if (results == null || results.isEmpty()) {
                return String.format("No results found for %s", url);
            }
            StringBuilder out = new StringBuilder();
            out.append(String.format("%d result(s) for %s%n", results.size(), url));
            for (ProviderData data : results) {
                out.append(format(data));
            }
            return out.toString();
        } catch (Exception e) {
            logger.error("Search for {} failed: {}", url, e.getMessage(), e);
            return String.format("Search failed: %s", e.getMessage());
        }
    }

    @ShellMethod(value = "Show search cache entry counts and search counters", key = "ris cache-stats")
    public Map<String, Long> cacheStats() {
        try {
            CacheStats stats = cacheService.getCacheStats();
            Map<String, Long> out = new LinkedHashMap<>();
            out.put("provider_results", stats.providerResults());
            out.put("image_links", stats.imageLinks());
            out.put("not_found", stats.notFound());
            out.put("total", stats.total());
            out.put("users", cacheService.getTotalUserCount());
            out.put("searches", cacheService.getTotalSearchCount());
            return out;
        } catch (Exception e) {
            logger.error("Failed to read cache stats: {}", e.getMessage(), e);
            return Map.of("error", 1L);
        }
    }

    @ShellMethod(value = "Clear the not-found markers so unmatched images are searched again", key = "ris clear-not-found")
    public String clearNotFound() {
        try {
            return String.format("Cleared %d not-found markers", cacheService.clearNotFoundCache());
        } catch (Exception e) {
            logger.error("Failed to clear not-found cache: {}", e.getMessage(), e);
            return String.format("Clearing not-found cache failed: %s", e.getMessage());
        }
    }

    @ShellMethod(value = "Clear all cached provider results and their image links", key = "ris clear-provider-cache")
    public String clearProviderCache() {
        try {
            return String.format("Cleared %d cached provider results", cacheService.clearProviderDataCache());
        } catch (Exception e) {
            logger.error("Failed to clear provider cache: {}", e.getMessage(), e);
            return String.format("Clearing provider cache failed: %s", e.getMessage());
        }
    }

    static String format(ProviderData data) {
        StringBuilder out = new StringBuilder();
        out.append(String.format("%n[%s]", data.getProviderId()));
        if (data.getProviderLink() != null) {
            out.append(' ').append(data.getProviderLink());
        }
        out.append(System.lineSeparator());
        data.getFields().forEach((name, value) -> {
            String text = value instanceof List<?> list
                ? String.join(", ", list.stream().map(String::valueOf).toList())
                : String.valueOf(value);
            out.append(String.format("  %s: %s%n", name, text));
        });
        for (String link : data.getExtraLinks()) {
            out.append(String.format("  -> %s%n", link));
        }
        return out.toString();
    }
}
