package com.williamcallahan.reverse_image_search.engine;

import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import reactor.core.publisher.Flux;

/**
 * Reverse image search backend
 *
 * @author William Callahan
 */
public interface SearchEngine {

    SearchEngineName getName();

    /**
     * Queries the backend for an image
     * The returned Flux is cold: every subscription issues a new query. Records the
     * backend returns in an unexpected shape are skipped, transport failures terminate
     * the Flux with a {@link SearchTransportException}
     *
     * @param imageUrl publicly reachable URL of the image
     * @param imageId stable identifier of the image, used for log correlation
     * @return hits in the order the backend reports them
     */
    Flux<SearchHit> search(String imageUrl, String imageId);
}
