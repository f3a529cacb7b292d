/**
 * Immutable lookup of the providers available for each platform and search engine
 *
 * @author William Callahan
 *
 * Features:
 * - Built once at startup from every provider bean
 * - Rejects two providers claiming the same platform or engine
 * - Lookups return Optional, never null
 */

package com.williamcallahan.reverse_image_search.provider;

import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class ProviderRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<Platform, PlatformProvider> platformProviders;
    private final Map<SearchEngineName, SearchEngineGenericProvider> engineProviders;
    private final GenericProvider genericProvider;

    public ProviderRegistry(List<PlatformProvider> platformProviders,
                            List<SearchEngineGenericProvider> engineProviders,
                            GenericProvider genericProvider) {
        Map<Platform, PlatformProvider> byPlatform = new EnumMap<>(Platform.class);
        for (PlatformProvider provider : platformProviders) {
            PlatformProvider previous = byPlatform.putIfAbsent(provider.getPlatform(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider for platform " + provider.getPlatform().getId()
                    + ": " + previous.getClass().getSimpleName() + " and " + provider.getClass().getSimpleName());
            }
        }
        Map<SearchEngineName, SearchEngineGenericProvider> byEngine = new EnumMap<>(SearchEngineName.class);
        for (SearchEngineGenericProvider provider : engineProviders) {
            SearchEngineGenericProvider previous = byEngine.putIfAbsent(provider.getSearchEngine(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate generic provider for search engine " + provider.getSearchEngine().getId());
            }
        }
        this.platformProviders = Collections.unmodifiableMap(byPlatform);
        this.engineProviders = Collections.unmodifiableMap(byEngine);
        this.genericProvider = genericProvider;
        logger.info("Registered providers for platforms {} and search engines {}", byPlatform.keySet(), byEngine.keySet());
    }

    public Optional<PlatformProvider> forPlatform(Platform platform) {
        return Optional.ofNullable(platformProviders.get(platform));
    }

    public Optional<SearchEngineGenericProvider> forSearchEngine(SearchEngineName searchEngine) {
        return Optional.ofNullable(engineProviders.get(searchEngine));
    }

    public GenericProvider generic() {
        return genericProvider;
    }
}
