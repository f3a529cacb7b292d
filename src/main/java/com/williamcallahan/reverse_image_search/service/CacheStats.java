package com.williamcallahan.reverse_image_search.service;

/**
 * Entry counts per search cache category
 *
 * @param providerResults cached provider result rows
 * @param imageLinks image to provider result link sets
 * @param notFound negative cache markers
 */
public record CacheStats(long providerResults, long imageLinks, long notFound) {

    public long total() {
        return providerResults + imageLinks + notFound;
    }
}
