package com.williamcallahan.reverse_image_search.provider;

import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import reactor.core.publisher.Mono;

/**
 * Builds a result from what a search engine itself reported, without contacting the source platform
 */
public interface SearchEngineGenericProvider {

    SearchEngineName getSearchEngine();

    Mono<ProviderData> fetch(SearchHit hit);
}
