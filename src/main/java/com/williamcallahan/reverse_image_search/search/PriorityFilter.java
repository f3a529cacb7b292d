/**
 * Reduces a result list to the best results only
 *
 * @author William Callahan
 *
 * Features:
 * - Keeps only results at the best priority level present
 * - Within that level prefers results with more extra links
 * - Keeps one result per priority key
 * - Platforms without a priority rank below every ranked platform
 */

package com.williamcallahan.reverse_image_search.search;

import com.williamcallahan.reverse_image_search.model.ProviderData;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Component
public class PriorityFilter {

    /** Lower is better */
    static final Map<String, Integer> PRIORITIZED_PROVIDERS = Map.of(
        "danbooru", 0,
        "zerochan", 0,
        "pixiv", 20,
        "3dbooru", 20,
        "twitter", 20,
        "yandere", 30,
        "gelbooru", 30,
        "konachan", 30,
        "eshuushuu", 30
    );

    static final int DEFAULT_PRIORITY = Collections.max(PRIORITIZED_PROVIDERS.values()) + 10;

    public static int priorityOf(ProviderData result) {
        return PRIORITIZED_PROVIDERS.getOrDefault(result.getPriorityKey(), DEFAULT_PRIORITY);
    }

    public List<ProviderData> filter(List<ProviderData> results) {
        if (results == null || results.isEmpty()) {
            return List.of();
        }
        int best = results.stream().mapToInt(PriorityFilter::priorityOf).min().orElse(DEFAULT_PRIORITY);

        List<ProviderData> top = new ArrayList<>();
        for (ProviderData result : results) {
            if (priorityOf(result) == best) {
                top.add(result);
            }
        }
        top.sort(Comparator.<ProviderData>comparingInt(result -> -result.getExtraLinks().size())
            .thenComparing(ProviderData::getPriorityKey));

        Set<String> seen = new HashSet<>();
        List<ProviderData> filtered = new ArrayList<>();
        for (ProviderData result : top) {
            if (seen.add(result.getPriorityKey())) {
                filtered.add(result);
            }
        }
        return filtered;
    }
}
