/**
 * Repository persisting user settings one typed cache entry per field
 *
 * @author William Callahan
 *
 * Features:
 * - Reads every field in a single batched cache read
 * - Creates and persists default settings on first access
 * - Saves only the fields a caller names
 */

package com.williamcallahan.reverse_image_search.service;

import com.williamcallahan.reverse_image_search.cache.CacheDataType;
import com.williamcallahan.reverse_image_search.cache.CacheKey;
import com.williamcallahan.reverse_image_search.cache.TypedCacheStore;
import com.williamcallahan.reverse_image_search.model.UserSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class UserSettingsRepository {

    private static final Logger logger = LoggerFactory.getLogger(UserSettingsRepository.class);

    public enum Field {
        ENABLED_ENGINES("enabled_engines", true, CacheDataType.STRING),
        CACHE_ENABLED("cache_enabled", false, CacheDataType.BOOL),
        BEST_RESULTS_ONLY("best_results_only", false, CacheDataType.BOOL),
        BROADCAST_MESSAGE_CHAT_ID("broadcast_message_chat_id", false, CacheDataType.INT),
        BROADCAST_MESSAGE_ID("broadcast_message_id", false, CacheDataType.INT),
        SEARCH_COUNT("search_count", false, CacheDataType.INT);

        private final String suffix;
        private final boolean set;
        private final CacheDataType type;

        Field(String suffix, boolean set, CacheDataType type) {
            this.suffix = suffix;
            this.set = set;
            this.type = type;
        }

        public String key(long userId) {
            String name = "settings:" + userId + ":" + suffix;
            return (set ? CacheKey.setOf(type, name) : CacheKey.scalar(type, name)).toString();
        }
    }

    /** Search count is owned by {@link SearchCacheService#incrUserSearchCount(long)} */
    private static final Set<Field> SAVED_BY_DEFAULT = EnumSet.complementOf(EnumSet.of(Field.SEARCH_COUNT));

    private final TypedCacheStore cacheStore;

    public UserSettingsRepository(TypedCacheStore cacheStore) {
        this.cacheStore = cacheStore;
    }

    /**
     * Loads a user's settings, persisting defaults when the user has none yet
     */
    public UserSettings fetch(long userId) {
        Field[] fields = Field.values();
        List<String> keys = Arrays.stream(fields).map(field -> field.key(userId)).toList();
        List<Object> values = cacheStore.mget(keys);

        UserSettings settings = new UserSettings(userId);
        if (values.get(Field.CACHE_ENABLED.ordinal()) == null) {
            logger.info("Creating default settings for user {}", userId);
            save(settings);
            return settings;
        }

        Object engines = values.get(Field.ENABLED_ENGINES.ordinal());
        Set<String> enabledEngines = new LinkedHashSet<>();
        if (engines instanceof Collection<?> collection) {
            collection.forEach(engine -> enabledEngines.add(engine.toString()));
        }
        settings.setEnabledEngines(enabledEngines);
        settings.setCacheEnabled((Boolean) values.get(Field.CACHE_ENABLED.ordinal()));
        settings.setBestResultsOnly(Boolean.TRUE.equals(values.get(Field.BEST_RESULTS_ONLY.ordinal())));
        settings.setBroadcastMessageChatId(asLong(values.get(Field.BROADCAST_MESSAGE_CHAT_ID.ordinal())));
        settings.setBroadcastMessageId(asLong(values.get(Field.BROADCAST_MESSAGE_ID.ordinal())));
        Long searchCount = asLong(values.get(Field.SEARCH_COUNT.ordinal()));
        settings.setSearchCount(searchCount == null ? 0L : searchCount);
        return settings;
    }

    /**
     * Persists the named fields, or every field except the search count when none are named
     */
    public void save(UserSettings settings, Field... fields) {
        Set<Field> targets = fields.length == 0 ? SAVED_BY_DEFAULT : EnumSet.copyOf(Arrays.asList(fields));
        long userId = settings.getUserId();
        for (Field field : targets) {
            String key = field.key(userId);
            switch (field) {
                case ENABLED_ENGINES -> cacheStore.set(key, settings.getEnabledEngines());
                case CACHE_ENABLED -> cacheStore.set(key, settings.isCacheEnabled());
                case BEST_RESULTS_ONLY -> cacheStore.set(key, settings.isBestResultsOnly());
                case BROADCAST_MESSAGE_CHAT_ID -> cacheStore.set(key, settings.getBroadcastMessageChatId());
                case BROADCAST_MESSAGE_ID -> cacheStore.set(key, settings.getBroadcastMessageId());
                case SEARCH_COUNT -> cacheStore.set(key, settings.getSearchCount());
            }
        }
    }

    private static Long asLong(Object value) {
        return value instanceof Number number ? number.longValue() : null;
    }
}
