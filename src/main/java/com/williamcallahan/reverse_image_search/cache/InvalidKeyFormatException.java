package com.williamcallahan.reverse_image_search.cache;

/**
 * Thrown when a key carries the cache prefix but not a valid type tag, or when a bare key is ambiguous
 */
public class InvalidKeyFormatException extends CacheStoreException {

    public InvalidKeyFormatException(String message) {
        super(message);
    }
}
