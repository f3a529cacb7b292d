package com.williamcallahan.reverse_image_search.cache;

/**
 * Thrown when a stored value cannot be decoded as the type its key tag declares
 */
public class TypeMismatchException extends CacheStoreException {

    public TypeMismatchException(String message) {
        super(message);
    }

    public TypeMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
