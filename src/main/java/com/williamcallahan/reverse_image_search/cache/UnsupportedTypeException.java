package com.williamcallahan.reverse_image_search.cache;

/**
 * Thrown when a value's Java type has no cache tag, or does not fit the container of its key
 */
public class UnsupportedTypeException extends CacheStoreException {

    public UnsupportedTypeException(String message) {
        super(message);
    }
}
