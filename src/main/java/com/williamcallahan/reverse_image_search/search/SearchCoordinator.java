/**
 * Orchestrates one reverse image search across every enabled search engine
 * Checks the image caches, fans the query out to the engines concurrently,
 * deduplicates their hits by provider id, resolves each surviving hit with bounded
 * concurrency and caches every result as it is emitted
 *
 * @author William Callahan
 *
 * Features:
 * - Negative cache short-circuits images that matched nothing recently
 * - Cached results for an image are replayed without any network call
 * - The first hit for a provider id wins, later duplicates are dropped before resolution
 * - Per-provider cache lookups skip resolution for results found by earlier searches
 * - Engine and resolution failures are isolated and logged, never fatal to the search
 * - Results are emitted in resolution-completion order
 * - Degrades to an uncached run when Redis is unreachable
 * - Optional best-results-only filtering and result cap
 */

package com.williamcallahan.reverse_image_search.search;

import com.williamcallahan.reverse_image_search.cache.CacheStoreException;
import com.williamcallahan.reverse_image_search.cache.CacheUnavailableException;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.engine.SearchEngine;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import com.williamcallahan.reverse_image_search.model.UserSettings;
import com.williamcallahan.reverse_image_search.monitoring.SearchMetricsService;
import com.williamcallahan.reverse_image_search.provider.ProviderResolver;
import com.williamcallahan.reverse_image_search.service.SearchCacheService;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

@Service
public class SearchCoordinator {

    private static final Logger logger = LoggerFactory.getLogger(SearchCoordinator.class);

    private enum CacheState { NOT_FOUND, CACHED, MISS }

    private record CacheLookup(CacheState state, List<ProviderData> results) {
        static final CacheLookup MISS = new CacheLookup(CacheState.MISS, List.of());
        static final CacheLookup NOT_FOUND = new CacheLookup(CacheState.NOT_FOUND, List.of());
    }

    private final List<SearchEngine> engines;
    private final ProviderResolver providerResolver;
    private final SearchCacheService cacheService;
    private final PriorityFilter priorityFilter;
    private final SearchConfigurationProperties properties;
    private final SearchMetricsService metricsService;

    public SearchCoordinator(List<SearchEngine> engines,
                             ProviderResolver providerResolver,
                             SearchCacheService cacheService,
                             PriorityFilter priorityFilter,
                             SearchConfigurationProperties properties,
                             SearchMetricsService metricsService) {
        this.engines = List.copyOf(engines);
        this.providerResolver = providerResolver;
        this.cacheService = cacheService;
        this.priorityFilter = priorityFilter;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    /**
     * Searches for the sources of an image
     * The returned Flux is cold; cancelling it cancels every in-flight engine query and
     * resolution, and nothing is cached for a resolution that did not complete
     *
     * @param imageUrl publicly reachable URL of the image
     * @param imageId content hash of the image, stable across retries
     * @param settings the searching user's settings
     * @return resolved results, empty when nothing matched
     */
    public Flux<ProviderData> search(String imageUrl, String imageId, UserSettings settings) {
        return Flux.defer(() -> {
            logger.info("[{}] starting search", imageId);
            logger.debug("[{}] {}", imageId, settings);
            metricsService.incrementSearches();
            metricsService.incrementActiveSearches();
            Timer.Sample sample = metricsService.startSearchTimer();

            AtomicBoolean cacheWritable = new AtomicBoolean(settings.isCacheEnabled());
            Mono<CacheLookup> lookup = settings.isCacheEnabled()
                ? checkImageCache(imageId, cacheWritable)
                : Mono.just(CacheLookup.MISS);

            return lookup
                .flatMapMany(result -> switch (result.state()) {
                    case NOT_FOUND -> {
                        logger.debug("[{}] image is marked as not found", imageId);
                        metricsService.incrementNotFoundHits();
                        yield Flux.<ProviderData>empty();
                    }
                    case CACHED -> {
                        logger.debug("[{}] replaying {} cached results", imageId, result.results().size());
                        metricsService.incrementCachedReplays();
                        yield shape(Flux.fromIterable(result.results()), settings, imageId);
                    }
                    case MISS -> runSearch(imageUrl, imageId, settings, cacheWritable);
                })
                .doFinally(signal -> {
                    metricsService.decrementActiveSearches();
                    metricsService.stopSearchTimer(sample);
                    logger.info("[{}] search finished ({})", imageId, signal);
                });
        });
    }

    private Mono<CacheLookup> checkImageCache(String imageId, AtomicBoolean cacheWritable) {
        return cacheService.isImageMarkedAsNotFoundReactive(imageId)
            .flatMap(notFound -> {
                if (notFound) {
                    return Mono.just(CacheLookup.NOT_FOUND);
                }
                return cacheService.getCachedProviderDataByImageReactive(imageId)
                    .map(cached -> {
                        if (cached.isEmpty()) {
                            logger.debug("[{}] image is not cached", imageId);
                            return CacheLookup.MISS;
                        }
                        return new CacheLookup(CacheState.CACHED, cached);
                    });
            })
            .defaultIfEmpty(CacheLookup.MISS)
            .onErrorResume(CacheUnavailableException.class, e -> {
                disableCaching(imageId, cacheWritable, e);
                return Mono.just(CacheLookup.MISS);
            });
    }

    private Flux<ProviderData> runSearch(String imageUrl, String imageId, UserSettings settings, AtomicBoolean cacheWritable) {
        List<SearchEngine> enabled = enabledEngines(settings);
        if (enabled.isEmpty()) {
            logger.info("[{}] no search engines enabled", imageId);
            return Flux.empty();
        }
        logger.debug("[{}] querying {}", imageId, enabled.stream().map(engine -> engine.getName().getId()).toList());

        AtomicInteger resolvedCount = new AtomicInteger();
        int resolverConcurrency = Math.max(1, properties.getResolverConcurrency());

        Flux<SearchHit> hits = Flux.fromIterable(enabled)
            .flatMap(engine -> queryEngine(engine, imageUrl, imageId), enabled.size());

        Flux<ProviderData> resolved = hits
            .distinct(SearchHit::providerId)
            .flatMap(hit -> resolveHit(hit, imageId, cacheWritable), resolverConcurrency)
            .concatMap(data -> persist(imageId, data, cacheWritable).thenReturn(data))
            .doOnNext(data -> {
                resolvedCount.incrementAndGet();
                logger.debug("[{}] {} resolved", imageId, data.getProviderId());
            });

        return shape(resolved, settings, imageId)
            .concatWith(Mono.defer(() -> {
                if (resolvedCount.get() > 0) {
                    return Mono.empty();
                }
                logger.info("[{}] no results found", imageId);
                return markNotFound(imageId, cacheWritable).then(Mono.empty());
            }));
    }

    private Flux<SearchHit> queryEngine(SearchEngine engine, String imageUrl, String imageId) {
        String name = engine.getName().getId();
        AtomicInteger count = new AtomicInteger();
        return engine.search(imageUrl, imageId)
            .doOnNext(hit -> count.incrementAndGet())
            .doOnComplete(() -> {
                logger.debug("[{}] {} returned {} hits", imageId, name, count.get());
                metricsService.incrementEngineHits(name, count.get());
            })
            .onErrorResume(e -> {
                logger.warn("[{}] {} search failed: {}", imageId, name, e.getMessage());
                metricsService.incrementEngineFailures(name);
                return Flux.empty();
            });
    }

    private Mono<ProviderData> resolveHit(SearchHit hit, String imageId, AtomicBoolean cacheWritable) {
        String providerId = hit.providerId();

        Mono<ProviderData> cached = Mono.defer(() -> {
            if (!cacheWritable.get()) {
                return Mono.<ProviderData>empty();
            }
            return cacheService.getCachedProviderDataReactive(providerId)
                .doOnNext(data -> {
                    logger.debug("[{}] {} served from provider cache", imageId, providerId);
                    metricsService.incrementResolutions("cached");
                })
                .onErrorResume(CacheUnavailableException.class, e -> {
                    disableCaching(imageId, cacheWritable, e);
                    return Mono.empty();
                });
        });

        Mono<ProviderData> fresh = Mono.defer(() -> {
            logger.debug("[{}] resolving {}", imageId, providerId);
            return providerResolver.resolve(hit)
                .doOnSuccess(data -> metricsService.incrementResolutions(data == null ? "empty" : "resolved"));
        });

        return cached
            .switchIfEmpty(fresh)
            .onErrorResume(e -> !(e instanceof CacheStoreException), e -> {
                logger.warn("[{}] resolving {} failed: {}", imageId, providerId, e.getMessage());
                metricsService.incrementResolutions("failed");
                return Mono.empty();
            });
    }

    private Mono<Void> persist(String imageId, ProviderData data, AtomicBoolean cacheWritable) {
        return Mono.defer(() -> {
            if (!cacheWritable.get()) {
                return Mono.<Void>empty();
            }
            return cacheService.cacheProviderDataReactive(imageId, data)
                .onErrorResume(CacheUnavailableException.class, e -> {
                    disableCaching(imageId, cacheWritable, e);
                    return Mono.empty();
                });
        });
    }

    private Mono<Void> markNotFound(String imageId, AtomicBoolean cacheWritable) {
        return Mono.defer(() -> {
            if (!cacheWritable.get()) {
                return Mono.<Void>empty();
            }
            return cacheService.markImageAsNotFoundReactive(imageId)
                .doOnSuccess(ignored -> metricsService.incrementNotFoundMarks())
                .onErrorResume(CacheUnavailableException.class, e -> {
                    disableCaching(imageId, cacheWritable, e);
                    return Mono.empty();
                });
        });
    }

    /**
     * Applies best-results-only filtering and the result cap
     */
    private Flux<ProviderData> shape(Flux<ProviderData> results, UserSettings settings, String imageId) {
        Flux<ProviderData> shaped = results;
        if (settings.isBestResultsOnly()) {
            shaped = shaped.collectList()
                .flatMapIterable(all -> {
                    List<ProviderData> best = priorityFilter.filter(all);
                    logger.debug("[{}] best results only: before={} after={}", imageId, all.size(), best.size());
                    return best;
                });
        }
        int maxResults = properties.getMaxResults();
        return maxResults > 0 ? shaped.take(maxResults) : shaped;
    }

    private List<SearchEngine> enabledEngines(UserSettings settings) {
        Set<SearchEngineName> enabled = EnumSet.noneOf(SearchEngineName.class);
        for (String name : settings.getEnabledEngines()) {
            Optional<SearchEngineName> engine = SearchEngineName.fromName(name);
            if (engine.isPresent()) {
                enabled.add(engine.get());
            } else {
                logger.debug("Ignoring unknown search engine '{}' in user settings", name);
            }
        }
        return engines.stream().filter(engine -> enabled.contains(engine.getName())).toList();
    }

    private void disableCaching(String imageId, AtomicBoolean cacheWritable, CacheUnavailableException e) {
        if (cacheWritable.getAndSet(false)) {
            logger.warn("[{}] cache unavailable, continuing without caching: {}", imageId, e.getMessage());
            metricsService.incrementCacheUnavailable();
        }
    }
}
