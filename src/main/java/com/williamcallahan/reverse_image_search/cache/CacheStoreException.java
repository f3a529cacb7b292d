/**
 * Base type for typed cache store failures caused by bad keys or bad data
 *
 * @author William Callahan
 *
 * Features:
 * - Unchecked so callers are not forced to handle programming errors
 * - Subclassed per failure kind for precise handling in tests and callers
 */

package com.williamcallahan.reverse_image_search.cache;

public class CacheStoreException extends RuntimeException {

    public CacheStoreException(String message) {
        super(message);
    }

    public CacheStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
