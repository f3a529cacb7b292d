/**
 * Utility class for Redis operations with uniform exception translation
 * Turns Jedis failures into the cache layer's own exception types so callers
 * can tell an unreachable server apart from a key holding the wrong kind of value
 *
 * @author William Callahan
 *
 * Features:
 * - Connection and pool failures become CacheUnavailableException
 * - WRONGTYPE replies become TypeMismatchException
 * - Any other server error reply (LOADING, READONLY, OOM, NOAUTH, BUSY) counts as unavailable
 * - Optional timing of each operation at debug level
 * - Cursor-based SCAN for pattern lookups without blocking the server
 */

package com.williamcallahan.reverse_image_search.util;

import com.williamcallahan.reverse_image_search.cache.CacheUnavailableException;
import com.williamcallahan.reverse_image_search.cache.TypeMismatchException;
import org.slf4j.Logger;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.function.Supplier;

public final class RedisHelper {

    /** SCAN batch hint */
    public static final int DEFAULT_SCAN_COUNT = 500;

    private RedisHelper() {
    }

    /**
     * Executes a Redis operation and translates Jedis exceptions
     *
     * @param log       SLF4J Logger to record failures
     * @param jedisCall Supplier performing the Jedis call
     * @param operation Description of the Redis operation (for logging)
     * @param <T>       Return type
     * @return Result of jedisCall.get()
     * @throws CacheUnavailableException when Redis cannot be reached or refuses to serve the command
     * @throws TypeMismatchException when Redis rejects the command for the stored value's type
     */
    public static <T> T execute(Logger log, Supplier<T> jedisCall, String operation) {
        try {
            return jedisCall.get();
        } catch (JedisConnectionException e) {
            log.warn("Redis {} failed, connection unavailable: {}", operation, e.getMessage());
            throw new CacheUnavailableException("Redis unavailable during " + operation, e);
        } catch (JedisDataException e) {
            if (e.getMessage() != null && e.getMessage().startsWith("WRONGTYPE")) {
                log.warn("Redis {} rejected: {}", operation, e.getMessage());
                throw new TypeMismatchException("Redis rejected " + operation + ": " + e.getMessage(), e);
            }
            log.warn("Redis {} failed, server not serving requests: {}", operation, e.getMessage());
            throw new CacheUnavailableException("Redis refused " + operation + ": " + e.getMessage(), e);
        } catch (JedisException e) {
            log.warn("Redis {} failed ({}): {}", operation, e.getClass().getSimpleName(), e.getMessage());
            throw new CacheUnavailableException("Redis error during " + operation, e);
        }
    }

    /**
     * Same as {@link #execute(Logger, Supplier, String)} with the elapsed time logged at debug level
     */
    public static <T> T executeWithTiming(Logger log, Supplier<T> operation, String operationName) {
        Instant start = Instant.now();
        T result = execute(log, operation, operationName);
        log.debug("Redis operation {} completed in {} ms", operationName, Duration.between(start, Instant.now()).toMillis());
        return result;
    }

    /**
     * Performs Redis SCAN to find keys matching a glob pattern
     *
     * @param jedisPooled Redis connection pool
     * @param pattern key pattern to match (supports wildcards and character classes)
     * @param count hint for number of keys to return per scan iteration
     * @return matching keys in discovery order
     */
    public static Set<String> scanKeys(JedisPooled jedisPooled, String pattern, int count) {
        Set<String> keys = new LinkedHashSet<>();
        ScanParams scanParams = new ScanParams().match(pattern).count(count);
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            ScanResult<String> scanResult = jedisPooled.scan(cursor, scanParams);
            keys.addAll(scanResult.getResult());
            cursor = scanResult.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        return keys;
    }
}
