package com.williamcallahan.reverse_image_search.cache;

public class CacheKeyNotFoundException extends CacheStoreException {

    public CacheKeyNotFoundException(String key) {
        super("No cache entry matches key '" + key + "'");
    }
}
