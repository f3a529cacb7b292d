package com.williamcallahan.reverse_image_search.model;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-user search preferences, persisted field by field in the typed cache
 *
 * @author William Callahan
 */
public class UserSettings {

    private final long userId;
    private Set<String> enabledEngines = defaultEnabledEngines();
    private boolean cacheEnabled = true;
    private boolean bestResultsOnly = false;
    private Long broadcastMessageChatId;
    private Long broadcastMessageId;
    private long searchCount = 0L;

    public UserSettings(long userId) {
        this.userId = userId;
    }

    public static Set<String> defaultEnabledEngines() {
        return Arrays.stream(SearchEngineName.values())
            .map(SearchEngineName::getDisplayName)
            .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public long getUserId() {
        return userId;
    }

    public Set<String> getEnabledEngines() {
        return enabledEngines;
    }

    public void setEnabledEngines(Set<String> enabledEngines) {
        this.enabledEngines = enabledEngines == null ? new LinkedHashSet<>() : new LinkedHashSet<>(enabledEngines);
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public void setCacheEnabled(boolean cacheEnabled) {
        this.cacheEnabled = cacheEnabled;
    }

    public boolean isBestResultsOnly() {
        return bestResultsOnly;
    }

    public void setBestResultsOnly(boolean bestResultsOnly) {
        this.bestResultsOnly = bestResultsOnly;
    }

    public Long getBroadcastMessageChatId() {
        return broadcastMessageChatId;
    }

    public void setBroadcastMessageChatId(Long broadcastMessageChatId) {
        this.broadcastMessageChatId = broadcastMessageChatId;
    }

    public Long getBroadcastMessageId() {
        return broadcastMessageId;
    }

    public void setBroadcastMessageId(Long broadcastMessageId) {
        this.broadcastMessageId = broadcastMessageId;
    }

    public long getSearchCount() {
        return searchCount;
    }

    public void setSearchCount(long searchCount) {
        this.searchCount = searchCount;
    }

    @Override
    public String toString() {
        return "UserSettings{userId=" + userId + ", enabledEngines=" + enabledEngines + ", cacheEnabled=" + cacheEnabled
            + ", bestResultsOnly=" + bestResultsOnly + ", searchCount=" + searchCount + "}";
    }
}
