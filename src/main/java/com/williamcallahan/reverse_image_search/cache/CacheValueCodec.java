/**
 * Converts between Java values and their Redis string form for each cache type
 *
 * @author William Callahan
 *
 * Features:
 * - Booleans stored as "1"/"0", integers as decimal, floats as Double text
 * - JSON values written and read with the shared Jackson ObjectMapper
 * - Decoding failures reported as TypeMismatchException with the offending key
 */

package com.williamcallahan.reverse_image_search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class CacheValueCodec {

    private final ObjectMapper objectMapper;

    public CacheValueCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(CacheDataType type, Object value) {
        if (value == null) {
            throw new UnsupportedTypeException("Null values cannot be cached as " + type);
        }
        return switch (type) {
            case STRING -> value.toString();
            case INT -> {
                if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
                    yield value.toString();
                }
                throw unsupported(type, value);
            }
            case FLOAT -> {
                if (value instanceof Float single) {
                    // shortest decimal form of the float, so 0.1f is stored as "0.1"
                    yield Float.toString(single);
                }
                if (value instanceof Number number) {
                    yield Double.toString(number.doubleValue());
                }
                throw unsupported(type, value);
            }
            case BOOL -> {
                if (value instanceof Boolean bool) {
                    yield bool ? "1" : "0";
                }
                throw unsupported(type, value);
            }
            case JSON -> {
                try {
                    yield objectMapper.writeValueAsString(value);
                } catch (JsonProcessingException e) {
                    throw new UnsupportedTypeException("Value of type " + value.getClass().getSimpleName()
                        + " cannot be serialized to JSON: " + e.getOriginalMessage());
                }
            }
        };
    }

    public Object decode(CacheDataType type, String raw, String key) {
        if (raw == null) {
            return null;
        }
        return switch (type) {
            case STRING -> raw;
            case INT -> {
                try {
                    yield Long.parseLong(raw.trim());
                } catch (NumberFormatException e) {
                    throw new TypeMismatchException("Value '" + raw + "' under " + key + " is not an integer", e);
                }
            }
            case FLOAT -> {
                try {
                    yield Double.parseDouble(raw.trim());
                } catch (NumberFormatException e) {
                    throw new TypeMismatchException("Value '" + raw + "' under " + key + " is not a float", e);
                }
            }
            case BOOL -> switch (raw.trim().toLowerCase()) {
                case "1", "true" -> Boolean.TRUE;
                case "0", "false" -> Boolean.FALSE;
                default -> throw new TypeMismatchException("Value '" + raw + "' under " + key + " is not a boolean");
            };
            case JSON -> {
                try {
                    yield objectMapper.readValue(raw, Object.class);
                } catch (JsonProcessingException e) {
                    throw new TypeMismatchException("Value under " + key + " is not valid JSON: " + e.getOriginalMessage(), e);
                }
            }
        };
    }

    private static UnsupportedTypeException unsupported(CacheDataType type, Object value) {
        return new UnsupportedTypeException("Value of type " + value.getClass().getSimpleName() + " cannot be stored as " + type);
    }
}
