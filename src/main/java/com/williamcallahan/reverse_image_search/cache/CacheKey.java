/**
 * Parsed form of a self-describing cache key
 *
 * @author William Callahan
 *
 * Features:
 * - Grammar is ris:<container><type>:<name>, container s (scalar) or x (set)
 * - A lone type letter (ris:b:<name>) is read as a scalar and written back verbatim
 * - The tag is the only source of truth for decoding a stored value
 * - Bare names are told apart from malformed qualified keys
 */

package com.williamcallahan.reverse_image_search.cache;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record CacheKey(boolean set, CacheDataType type, String name, boolean shortTag) {

    public static final String PREFIX = "ris:";
    private static final Pattern KEY_PATTERN = Pattern.compile("^ris:([sx]?[sifbj]):(.+)$");

    public CacheKey {
        Objects.requireNonNull(type, "type");
        if (name == null || name.isEmpty()) {
            throw new InvalidKeyFormatException("Cache key name must not be empty");
        }
        if (set && type == CacheDataType.JSON) {
            throw new UnsupportedTypeException("Sets of JSON values are not supported: " + name);
        }
        if (set && shortTag) {
            throw new InvalidKeyFormatException("Set keys always carry the x container tag: " + name);
        }
    }

    public static CacheKey scalar(CacheDataType type, String name) {
        return new CacheKey(false, type, name, false);
    }

    public static CacheKey setOf(CacheDataType type, String name) {
        return new CacheKey(true, type, name, false);
    }

    /**
     * Parses a key that may be fully qualified or bare
     *
     * @param key raw key
     * @return the parsed key, or empty when the key is bare
     * @throws InvalidKeyFormatException when the key starts with the prefix but breaks the grammar
     */
    public static Optional<CacheKey> parse(String key) {
        if (key == null || key.isEmpty()) {
            throw new InvalidKeyFormatException("Cache key must not be empty");
        }
        if (!key.startsWith(PREFIX)) {
            return Optional.empty();
        }
        Matcher matcher = KEY_PATTERN.matcher(key);
        if (!matcher.matches()) {
            throw new InvalidKeyFormatException("Invalid cache key format: " + key);
        }
        String tag = matcher.group(1);
        boolean shortTag = tag.length() == 1;
        boolean set = !shortTag && tag.charAt(0) == 'x';
        CacheDataType type = CacheDataType.fromTag(tag.charAt(tag.length() - 1))
            .orElseThrow(() -> new InvalidKeyFormatException("Unknown type tag in key: " + key));
        if (set && type == CacheDataType.JSON) {
            throw new InvalidKeyFormatException("Sets of JSON values are not supported: " + key);
        }
        return Optional.of(new CacheKey(set, type, matcher.group(2), shortTag));
    }

    /**
     * Parses a key that must be fully qualified
     */
    public static CacheKey parseQualified(String key) {
        return parse(key).orElseThrow(() -> new InvalidKeyFormatException("Expected a fully qualified cache key: " + key));
    }

    public String tag() {
        if (shortTag) {
            return String.valueOf(type.getTag());
        }
        return String.valueOf(set ? 'x' : 's') + type.getTag();
    }

    @Override
    public String toString() {
        return PREFIX + tag() + ":" + name;
    }
}
