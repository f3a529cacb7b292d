/**
 * Service for the search result cache kept in Redis
 * Stores resolved provider results keyed by provider id, links every image to the
 * provider results found for it, and records images that produced no match at all
 * so repeat lookups skip the search engines entirely. Both synchronous and reactive
 * methods are available; the reactive ones run the blocking Jedis calls on the
 * bounded elastic scheduler
 *
 * @author William Callahan
 *
 * Features:
 * - Provider results serialized to JSON under ris:provider_result:<providerId>
 * - Image to provider result links kept as Redis sets
 * - Negative cache markers with a configurable time to live
 * - Cache maintenance: clearing, statistics with cursor-based SCAN
 * - Per-user and total search counters plus the active user set
 * - Redis connection failures surface as CacheUnavailableException
 */

package com.williamcallahan.reverse_image_search.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.reverse_image_search.cache.CacheDataType;
import com.williamcallahan.reverse_image_search.cache.CacheKey;
import com.williamcallahan.reverse_image_search.cache.TypedCacheStore;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.util.RedisHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.Pipeline;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
public class SearchCacheService {

    private static final Logger logger = LoggerFactory.getLogger(SearchCacheService.class);

    public static final String PROVIDER_RESULT_PREFIX = "ris:provider_result:";
    public static final String IMAGE_LINK_PREFIX = "ris:image_to_provider_result_link:";
    public static final String NOT_FOUND_PREFIX = "ris:no_found:";

    private static final String ACTIVE_USERS_KEY = CacheKey.setOf(CacheDataType.INT, "active_users").toString();
    private static final String TOTAL_SEARCH_COUNT_KEY = CacheKey.scalar(CacheDataType.INT, "total_search_count").toString();
    private static final int DELETE_BATCH_SIZE = 500;

    private final JedisPooled jedisPooled;
    private final TypedCacheStore cacheStore;
    private final ObjectMapper objectMapper;
    private final SearchConfigurationProperties properties;

    public SearchCacheService(JedisPooled jedisPooled,
                              TypedCacheStore cacheStore,
                              ObjectMapper objectMapper,
                              SearchConfigurationProperties properties) {
        this.jedisPooled = jedisPooled;
        this.cacheStore = cacheStore;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public static String userSearchCountKey(long userId) {
        return CacheKey.scalar(CacheDataType.INT, "settings:" + userId + ":search_count").toString();
    }

    /**
     * Stores a resolved provider result and links it to the image it was found for
     *
     * @param imageId image the result was found for
     * @param data resolved provider result
     */
    public void cacheProviderData(String imageId, ProviderData data) {
        String json;
        try {
            json = objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Provider result " + data.getProviderId() + " cannot be serialized", e);
        }
        String resultKey = PROVIDER_RESULT_PREFIX + data.getProviderId();
        String linkKey = IMAGE_LINK_PREFIX + imageId;
        RedisHelper.execute(logger, () -> {
            try (Pipeline pipeline = jedisPooled.pipelined()) {
                pipeline.set(resultKey, json);
                pipeline.sadd(linkKey, data.getProviderId());
                pipeline.sync();
            }
            return null;
        }, "cache provider result " + data.getProviderId());
        logger.debug("[{}] Cached provider result {}", imageId, data.getProviderId());
    }

    /**
     * Reads provider results in one MGET, skipping ids that are not cached
     */
    public List<ProviderData> getCachedProviderData(Collection<String> providerIds) {
        if (providerIds == null || providerIds.isEmpty()) {
            return Collections.emptyList();
        }
        String[] keys = providerIds.stream().map(id -> PROVIDER_RESULT_PREFIX + id).toArray(String[]::new);
        List<String> rows = RedisHelper.executeWithTiming(logger, () -> jedisPooled.mget(keys), "MGET provider results x" + keys.length);
        List<ProviderData> results = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            String row = rows.get(i);
            if (row == null) {
                continue;
            }
            try {
                results.add(objectMapper.readValue(row, ProviderData.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.warn("Skipping unreadable cached provider result {}: {}", keys[i], e.getMessage());
            }
        }
        return results;
    }

    /**
     * Reads every provider result previously linked to an image
     */
    public List<ProviderData> getCachedProviderDataByImage(String imageId) {
        String linkKey = IMAGE_LINK_PREFIX + imageId;
        Set<String> providerIds = RedisHelper.execute(logger, () -> jedisPooled.smembers(linkKey), "SMEMBERS " + linkKey);
        if (providerIds == null || providerIds.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> ordered = new ArrayList<>(providerIds);
        Collections.sort(ordered);
        return getCachedProviderData(ordered);
    }

    public void markImageAsNotFound(String imageId) {
        String key = NOT_FOUND_PREFIX + imageId;
        long ttlSeconds = Math.max(1L, properties.getNotFoundTtl().toSeconds());
        RedisHelper.execute(logger, () -> jedisPooled.setex(key, ttlSeconds, "1"), "SETEX " + key);
        logger.debug("[{}] Marked as not found for {}s", imageId, ttlSeconds);
    }

    public boolean isImageMarkedAsNotFound(String imageId) {
        String key = NOT_FOUND_PREFIX + imageId;
        return RedisHelper.execute(logger, () -> jedisPooled.exists(key), "EXISTS " + key);
    }

    /**
     * Removes every cached provider result together with the image links pointing at them
     *
     * @return number of provider result rows removed
     */
    public long clearProviderDataCache() {
        long removed = deleteByPattern(PROVIDER_RESULT_PREFIX + "*");
        long links = deleteByPattern(IMAGE_LINK_PREFIX + "*");
        logger.info("Cleared {} provider results and {} image links", removed, links);
        return removed;
    }

    /**
     * @return number of negative cache markers removed
     */
    public long clearNotFoundCache() {
        long removed = deleteByPattern(NOT_FOUND_PREFIX + "*");
        logger.info("Cleared {} not-found markers", removed);
        return removed;
    }

    public CacheStats getCacheStats() {
        return new CacheStats(
            countByPattern(PROVIDER_RESULT_PREFIX + "*"),
            countByPattern(IMAGE_LINK_PREFIX + "*"),
            countByPattern(NOT_FOUND_PREFIX + "*"));
    }

    private long countByPattern(String pattern) {
        return RedisHelper.execute(logger,
            () -> RedisHelper.scanKeys(jedisPooled, pattern, RedisHelper.DEFAULT_SCAN_COUNT), "SCAN " + pattern).size();
    }

    private long deleteByPattern(String pattern) {
        Set<String> keys = RedisHelper.execute(logger,
            () -> RedisHelper.scanKeys(jedisPooled, pattern, RedisHelper.DEFAULT_SCAN_COUNT), "SCAN " + pattern);
        List<String> batch = new ArrayList<>(DELETE_BATCH_SIZE);
        long removed = 0L;
        for (String key : keys) {
            batch.add(key);
            if (batch.size() == DELETE_BATCH_SIZE) {
                removed += deleteBatch(batch);
                batch.clear();
            }
        }
        if (!batch.isEmpty()) {
            removed += deleteBatch(batch);
        }
        return removed;
    }

    private long deleteBatch(List<String> keys) {
        String[] batch = keys.toArray(new String[0]);
        return RedisHelper.execute(logger, () -> jedisPooled.del(batch), "DEL x" + batch.length);
    }

    /**
     * Records one search for a user
     *
     * @return the user's search count after the increment
     */
    public long incrUserSearchCount(long userId) {
        RedisHelper.execute(logger, () -> jedisPooled.sadd(ACTIVE_USERS_KEY, Long.toString(userId)), "SADD " + ACTIVE_USERS_KEY);
        cacheStore.increment(TOTAL_SEARCH_COUNT_KEY, 1L);
        return cacheStore.increment(userSearchCountKey(userId), 1L);
    }

    public Set<Long> getUsers() {
        Object members = cacheStore.get(ACTIVE_USERS_KEY, Collections.emptySet());
        Set<Long> users = new LinkedHashSet<>();
        if (members instanceof Collection<?> collection) {
            for (Object member : collection) {
                users.add(((Number) member).longValue());
            }
        }
        return users;
    }

    public long getTotalUserCount() {
        return RedisHelper.execute(logger, () -> jedisPooled.scard(ACTIVE_USERS_KEY), "SCARD " + ACTIVE_USERS_KEY);
    }

    public long getTotalSearchCount() {
        return ((Number) cacheStore.get(TOTAL_SEARCH_COUNT_KEY, 0L)).longValue();
    }

    public long getUserSearchCount(long userId) {
        return ((Number) cacheStore.get(userSearchCountKey(userId), 0L)).longValue();
    }

    // Reactive variants

    public Mono<Boolean> isImageMarkedAsNotFoundReactive(String imageId) {
        return Mono.fromCallable(() -> isImageMarkedAsNotFound(imageId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    public Mono<List<ProviderData>> getCachedProviderDataByImageReactive(String imageId) {
        return Mono.fromCallable(() -> getCachedProviderDataByImage(imageId))
            .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * @return the cached result, empty when the provider id has not been resolved before
     */
    public Mono<ProviderData> getCachedProviderDataReactive(String providerId) {
        return Mono.fromCallable(() -> getCachedProviderData(List.of(providerId)))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(results -> results.isEmpty() ? Mono.empty() : Mono.just(results.get(0)));
    }

    public Mono<Void> cacheProviderDataReactive(String imageId, ProviderData data) {
        return Mono.fromRunnable(() -> cacheProviderData(imageId, data))
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }

    public Mono<Void> markImageAsNotFoundReactive(String imageId) {
        return Mono.fromRunnable(() -> markImageAsNotFound(imageId))
            .subscribeOn(Schedulers.boundedElastic())
            .then();
    }
}
