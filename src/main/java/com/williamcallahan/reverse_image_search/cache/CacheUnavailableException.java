/**
 * Exception thrown when Redis cannot be reached or its connection pool is exhausted
 *
 * @author William Callahan
 *
 * Features:
 * - Separates infrastructure outages from data errors
 * - Lets the search pipeline degrade to an uncached run instead of failing
 */

package com.williamcallahan.reverse_image_search.cache;

public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message) {
        super(message);
    }

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
