/**
 * Self-describing typed key/value store over Redis
 * Every value lives under a key of the form ris:<container><type>:<name>, so a
 * reader can decode it without any out-of-band schema
 *
 * @author William Callahan
 *
 * Features:
 * - Infers the type tag from the Java value when a bare key is written
 * - Updates sets incrementally with SREM/SADD of the delta only
 * - Resolves bare keys across all tags on read, rejecting ambiguous matches
 * - Batched reads: one MGET for scalars, one pipeline for sets, input order preserved
 * - Cursor-based SCAN for key listing
 */

package com.williamcallahan.reverse_image_search.cache;

import com.williamcallahan.reverse_image_search.util.RedisHelper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.Response;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Service
public class TypedCacheStore {

    private static final Logger logger = LoggerFactory.getLogger(TypedCacheStore.class);
    private static final String ANY_TAG_PATTERN = CacheKey.PREFIX + "[sx][sifbj]:";
    private static final String SHORT_TAG_PATTERN = CacheKey.PREFIX + "[sifbj]:";

    private final JedisPooled jedisPooled;
    private final CacheValueCodec codec;

    public TypedCacheStore(JedisPooled jedisPooled, CacheValueCodec codec) {
        this.jedisPooled = jedisPooled;
        this.codec = codec;
    }

    /**
     * Writes a value, inferring the type tag when the key is bare
     *
     * @param key fully qualified or bare key
     * @param value value to store, null removes a scalar entry
     */
    public void set(String key, Object value) {
        set(key, value, null);
    }

    /**
     * Writes a value with an explicit element type for sets stored under a bare key
     *
     * @param key fully qualified or bare key
     * @param value value to store
     * @param setElementType element type for set values, inferred from the first member when null
     */
    public void set(String key, Object value, CacheDataType setElementType) {
        CacheKey cacheKey = CacheKey.parse(key).orElseGet(() -> inferKey(key, value, setElementType));
        if (cacheKey.set()) {
            if (!(value instanceof Set<?> members)) {
                throw new UnsupportedTypeException("Set key " + cacheKey + " requires a Set value but got "
                    + (value == null ? "null" : value.getClass().getSimpleName()));
            }
            writeSet(cacheKey, members);
            return;
        }
        if (value instanceof Set<?>) {
            throw new InvalidKeyFormatException("Set value cannot be stored under scalar key " + cacheKey);
        }
        String qualified = cacheKey.toString();
        if (value == null) {
            RedisHelper.execute(logger, () -> jedisPooled.del(qualified), "DEL " + qualified);
            return;
        }
        String encoded = codec.encode(cacheKey.type(), value);
        RedisHelper.execute(logger, () -> jedisPooled.set(qualified, encoded), "SET " + qualified);
    }

    private CacheKey inferKey(String name, Object value, CacheDataType setElementType) {
        if (value instanceof Set<?> members) {
            CacheDataType elementType = setElementType;
            if (elementType == null) {
                elementType = members.isEmpty()
                    ? CacheDataType.STRING
                    : CacheDataType.inferFrom(members.iterator().next()).orElseThrow(() -> unsupported(members.iterator().next()));
            }
            return CacheKey.setOf(elementType, name);
        }
        CacheDataType type = CacheDataType.inferFrom(value).orElseThrow(() -> unsupported(value));
        return CacheKey.scalar(type, name);
    }

    private static UnsupportedTypeException unsupported(Object value) {
        return new UnsupportedTypeException("No cache type for values of type " + value.getClass().getName());
    }

    private void writeSet(CacheKey cacheKey, Set<?> members) {
        String qualified = cacheKey.toString();
        Set<String> desired = new LinkedHashSet<>();
        for (Object member : members) {
            desired.add(codec.encode(cacheKey.type(), member));
        }
        Set<String> current = RedisHelper.execute(logger, () -> jedisPooled.smembers(qualified), "SMEMBERS " + qualified);

        Set<String> removed = new LinkedHashSet<>(current);
        removed.removeAll(desired);
        Set<String> added = new LinkedHashSet<>(desired);
        added.removeAll(current);

        if (!removed.isEmpty()) {
            RedisHelper.execute(logger, () -> jedisPooled.srem(qualified, removed.toArray(new String[0])), "SREM " + qualified);
        }
        if (!added.isEmpty()) {
            RedisHelper.execute(logger, () -> jedisPooled.sadd(qualified, added.toArray(new String[0])), "SADD " + qualified);
        }
        logger.debug("Set {} updated: {} added, {} removed", qualified, added.size(), removed.size());
    }

    /**
     * Reads and decodes a value
     * Integers always come back as Long and floats as Double, whatever type was written,
     * so compare against 5L rather than Integer.valueOf(5); a Float is stored in its
     * shortest decimal form and reads back as the Double with that text
     *
     * @param key fully qualified or bare key
     * @return decoded value, an empty set for a missing set key
     * @throws CacheKeyNotFoundException when no scalar entry exists
     */
    public Object get(String key) {
        return get(key, null, false);
    }

    /**
     * Reads and decodes a value, returning the default when the entry is missing
     */
    public Object get(String key, Object defaultValue) {
        return get(key, defaultValue, true);
    }

    private Object get(String key, Object defaultValue, boolean hasDefault) {
        Optional<CacheKey> parsed = CacheKey.parse(key);
        CacheKey cacheKey;
        if (parsed.isPresent()) {
            cacheKey = parsed.get();
        } else {
            Optional<CacheKey> resolved = resolveBareKey(key);
            if (resolved.isEmpty()) {
                if (hasDefault) {
                    return defaultValue;
                }
                throw new CacheKeyNotFoundException(key);
            }
            cacheKey = resolved.get();
        }

        String qualified = cacheKey.toString();
        if (cacheKey.set()) {
            Set<String> members = RedisHelper.execute(logger, () -> jedisPooled.smembers(qualified), "SMEMBERS " + qualified);
            if (members.isEmpty() && hasDefault) {
                return defaultValue;
            }
            return decodeSet(cacheKey, members);
        }

        String raw = RedisHelper.execute(logger, () -> jedisPooled.get(qualified), "GET " + qualified);
        if (raw == null) {
            if (hasDefault) {
                return defaultValue;
            }
            throw new CacheKeyNotFoundException(qualified);
        }
        return codec.decode(cacheKey.type(), raw, qualified);
    }

    private Optional<CacheKey> resolveBareKey(String name) {
        List<String> matches = keys(name);
        if (matches.isEmpty()) {
            return Optional.empty();
        }
        if (matches.size() > 1) {
            throw new InvalidKeyFormatException("Bare key '" + name + "' is ambiguous, matches " + matches);
        }
        return CacheKey.parse(matches.get(0));
    }

    private Set<Object> decodeSet(CacheKey cacheKey, Set<String> members) {
        Set<Object> decoded = new LinkedHashSet<>();
        for (String member : members) {
            decoded.add(codec.decode(cacheKey.type(), member, cacheKey.toString()));
        }
        return decoded;
    }

    /**
     * Batch read of fully qualified keys, missing sets reported as null
     */
    public List<Object> mget(List<String> keys) {
        return mget(keys, true);
    }

    /**
     * Batch read of fully qualified keys in one MGET plus one pipeline
     *
     * @param keys fully qualified keys
     * @param markNonExistingSets report missing set keys as null instead of an empty set
     * @return decoded values in input order, null for missing scalars
     */
    public List<Object> mget(List<String> keys, boolean markNonExistingSets) {
        if (keys == null || keys.isEmpty()) {
            return Collections.emptyList();
        }
        List<CacheKey> parsed = keys.stream().map(CacheKey::parseQualified).toList();

        List<Integer> scalarIndexes = new ArrayList<>();
        List<Integer> setIndexes = new ArrayList<>();
        for (int i = 0; i < parsed.size(); i++) {
            (parsed.get(i).set() ? setIndexes : scalarIndexes).add(i);
        }

        Object[] results = new Object[parsed.size()];

        if (!scalarIndexes.isEmpty()) {
            String[] scalarKeys = scalarIndexes.stream().map(i -> parsed.get(i).toString()).toArray(String[]::new);
            List<String> raw = RedisHelper.executeWithTiming(logger, () -> jedisPooled.mget(scalarKeys), "MGET x" + scalarKeys.length);
            for (int j = 0; j < scalarIndexes.size(); j++) {
                CacheKey cacheKey = parsed.get(scalarIndexes.get(j));
                results[scalarIndexes.get(j)] = codec.decode(cacheKey.type(), raw.get(j), cacheKey.toString());
            }
        }

        if (!setIndexes.isEmpty()) {
            List<Response<Boolean>> existsResponses = new ArrayList<>(setIndexes.size());
            List<Response<Set<String>>> memberResponses = new ArrayList<>(setIndexes.size());
            RedisHelper.executeWithTiming(logger, () -> {
                try (Pipeline pipeline = jedisPooled.pipelined()) {
                    for (Integer index : setIndexes) {
                        String qualified = parsed.get(index).toString();
                        existsResponses.add(pipeline.exists(qualified));
                        memberResponses.add(pipeline.smembers(qualified));
                    }
                    pipeline.sync();
                }
                return null;
            }, "pipelined SMEMBERS x" + setIndexes.size());

            for (int j = 0; j < setIndexes.size(); j++) {
                CacheKey cacheKey = parsed.get(setIndexes.get(j));
                boolean exists = Boolean.TRUE.equals(existsResponses.get(j).get());
                if (!exists) {
                    results[setIndexes.get(j)] = markNonExistingSets ? null : new LinkedHashSet<>();
                } else {
                    results[setIndexes.get(j)] = decodeSet(cacheKey, memberResponses.get(j).get());
                }
            }
        }

        return Arrays.asList(results);
    }

    /**
     * Batch read keyed by the fully qualified key
     */
    public Map<String, Object> mgetDict(List<String> keys) {
        List<Object> values = mget(keys);
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            result.put(keys.get(i), values.get(i));
        }
        return result;
    }

    /**
     * Batch read keyed by the key name with its "ris:<tag>:" prefix stripped
     */
    public Map<String, Object> mgetDictShort(List<String> keys) {
        List<Object> values = mget(keys);
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            result.put(CacheKey.parseQualified(keys.get(i)).name(), values.get(i));
        }
        return result;
    }

    /**
     * Lists keys matching a glob pattern
     *
     * @param pattern fully qualified glob, or a bare name glob matched across every tag, one-letter tags included
     * @return matching fully qualified keys, sorted
     */
    public List<String> keys(String pattern) {
        Set<String> found = new LinkedHashSet<>();
        if (pattern.startsWith(CacheKey.PREFIX)) {
            found.addAll(scan(pattern));
        } else {
            found.addAll(scan(ANY_TAG_PATTERN + pattern));
            found.addAll(scan(SHORT_TAG_PATTERN + pattern));
        }
        List<String> sorted = new ArrayList<>(found);
        Collections.sort(sorted);
        return sorted;
    }

    private Set<String> scan(String pattern) {
        return RedisHelper.execute(logger,
            () -> RedisHelper.scanKeys(jedisPooled, pattern, RedisHelper.DEFAULT_SCAN_COUNT), "SCAN " + pattern);
    }

    /**
     * Increments a scalar integer entry, creating it at zero first when absent
     *
     * @param key fully qualified "si" key, or a bare name stored as an integer
     * @return the value after the increment
     */
    public long increment(String key, long delta) {
        CacheKey cacheKey = CacheKey.parse(key).orElseGet(() -> CacheKey.scalar(CacheDataType.INT, key));
        if (cacheKey.set() || cacheKey.type() != CacheDataType.INT) {
            throw new UnsupportedTypeException("Only scalar integer keys can be incremented: " + cacheKey);
        }
        String qualified = cacheKey.toString();
        return RedisHelper.execute(logger, () -> jedisPooled.incrBy(qualified, delta), "INCRBY " + qualified);
    }

    /**
     * Deletes entries, bare keys removing every tagged variant of the name
     *
     * @return number of keys removed
     */
    public long delete(Collection<String> keys) {
        Set<String> targets = new LinkedHashSet<>();
        for (String key : keys) {
            Optional<CacheKey> parsed = CacheKey.parse(key);
            if (parsed.isPresent()) {
                targets.add(parsed.get().toString());
            } else {
                targets.addAll(keys(key));
            }
        }
        if (targets.isEmpty()) {
            return 0L;
        }
        return RedisHelper.execute(logger, () -> jedisPooled.del(targets.toArray(new String[0])), "DEL x" + targets.size());
    }
}
