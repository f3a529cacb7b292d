package com.williamcallahan.reverse_image_search.cache;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Element types a cache entry can hold, with their single-letter wire tag
 *
 * @author William Callahan
 */
public enum CacheDataType {
    STRING('s'),
    INT('i'),
    FLOAT('f'),
    BOOL('b'),
    JSON('j');

    private final char tag;

    CacheDataType(char tag) {
        this.tag = tag;
    }

    public char getTag() {
        return tag;
    }

    public static Optional<CacheDataType> fromTag(char tag) {
        for (CacheDataType type : values()) {
            if (type.tag == tag) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Infers the tag for a scalar value, or for a set element
     *
     * @param value value to classify, never a Set
     * @return the matching type, empty when the Java type has no tag
     */
    public static Optional<CacheDataType> inferFrom(Object value) {
        if (value == null || value instanceof String) {
            return Optional.of(STRING);
        }
        if (value instanceof Boolean) {
            return Optional.of(BOOL);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return Optional.of(INT);
        }
        if (value instanceof Float || value instanceof Double) {
            return Optional.of(FLOAT);
        }
        if (value instanceof Map<?, ?> || (value instanceof Collection<?> && !(value instanceof Set<?>))) {
            return Optional.of(JSON);
        }
        return Optional.empty();
    }
}
