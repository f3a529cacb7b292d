package com.williamcallahan.reverse_image_search.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.reverse_image_search.cache.CacheUnavailableException;
import com.williamcallahan.reverse_image_search.cache.CacheValueCodec;
import com.williamcallahan.reverse_image_search.cache.TypedCacheStore;
import com.williamcallahan.reverse_image_search.config.SearchConfigurationProperties;
import com.williamcallahan.reverse_image_search.engine.SearchEngine;
import com.williamcallahan.reverse_image_search.engine.SearchTransportException;
import com.williamcallahan.reverse_image_search.model.Platform;
import com.williamcallahan.reverse_image_search.model.ProviderData;
import com.williamcallahan.reverse_image_search.model.SearchEngineName;
import com.williamcallahan.reverse_image_search.model.SearchHit;
import com.williamcallahan.reverse_image_search.model.UserSettings;
import com.williamcallahan.reverse_image_search.monitoring.SearchMetricsService;
import com.williamcallahan.reverse_image_search.provider.ProviderResolver;
import com.williamcallahan.reverse_image_search.service.SearchCacheService;
import com.williamcallahan.reverse_image_search.testutil.FakeRedis;
import com.williamcallahan.reverse_image_search.testutil.Fixtures;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import redis.clients.jedis.exceptions.JedisDataException;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class SearchCoordinatorTest {

    private static final String IMAGE_URL = "https://example.com/a.jpg";
    private static final String IMAGE_ID = "img-1";
    private static final JsonNode PAYLOAD = Fixtures.parse("{\"search_link\": \"https://example.com/search\"}");

    private SearchEngine sauceNao;
    private SearchEngine iqdb;
    private ProviderResolver resolver;
    private SearchCacheService cacheService;
    private SearchConfigurationProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private SearchCoordinator coordinator;
    private UserSettings settings;

    @BeforeEach
    void setUp() {
        sauceNao = mock(SearchEngine.class);
        when(sauceNao.getName()).thenReturn(SearchEngineName.SAUCENAO);
        when(sauceNao.search(anyString(), anyString())).thenReturn(Flux.empty());
        iqdb = mock(SearchEngine.class);
        when(iqdb.getName()).thenReturn(SearchEngineName.IQDB);
        when(iqdb.search(anyString(), anyString())).thenReturn(Flux.empty());

        resolver = mock(ProviderResolver.class);
        when(resolver.resolve(any(SearchHit.class))).thenAnswer(invocation -> {
            SearchHit hit = invocation.getArgument(0);
            return Mono.just(result(hit));
        });

        cacheService = mock(SearchCacheService.class);
        when(cacheService.isImageMarkedAsNotFoundReactive(anyString())).thenReturn(Mono.just(false));
        when(cacheService.getCachedProviderDataByImageReactive(anyString())).thenReturn(Mono.just(List.of()));
        when(cacheService.getCachedProviderDataReactive(anyString())).thenReturn(Mono.empty());
        when(cacheService.cacheProviderDataReactive(anyString(), any())).thenReturn(Mono.empty());
        when(cacheService.markImageAsNotFoundReactive(anyString())).thenReturn(Mono.empty());

        properties = new SearchConfigurationProperties();
        meterRegistry = new SimpleMeterRegistry();
        coordinator = new SearchCoordinator(List.of(sauceNao, iqdb), resolver, cacheService, new PriorityFilter(),
            properties, new SearchMetricsService(meterRegistry));
        settings = new UserSettings(1L);
    }

    private static SearchHit hit(SearchEngineName engine, Platform platform, String id) {
        return hit(engine, platform, id, PAYLOAD);
    }

    private static SearchHit hit(SearchEngineName engine, Platform platform, String id, JsonNode payload) {
        return new SearchHit(engine, platform, id, 90.0, payload, "https://example.com/search");
    }

    private static ProviderData result(SearchHit hit) {
        String priorityKey = hit.platform().isKnown() ? hit.platform().getId() : hit.platformId();
        return ProviderData.builder(priorityKey, hit.providerId())
            .providerLink("https://example.com/" + hit.providerId())
            .build();
    }

    private static ProviderData result(String priorityKey, String providerId) {
        return ProviderData.builder(priorityKey, providerId).providerLink("https://example.com/" + providerId).build();
    }

    private List<String> providerIds(Flux<ProviderData> results) {
        List<ProviderData> collected = results.collectList().block(Duration.ofSeconds(5));
        assertNotNull(collected);
        return collected.stream().map(ProviderData::getProviderId).toList();
    }

    @Test
    void search_duplicateHitsAreResolvedAndCachedOnce() {
        JsonNode sauceNaoRecord = Fixtures.parse(
            "{\"header\": {\"similarity\": \"92.1\", \"index_id\": 9}, \"data\": {\"danbooru_id\": 555}}");
        JsonNode iqdbMatch = Fixtures.parse(
            "{\"post_link\": \"https://danbooru.donmai.us/posts/555\", \"size\": \"1200×1600\", \"nsfw\": false}");
        when(sauceNao.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "555", sauceNaoRecord)));
        when(iqdb.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.IQDB, Platform.DANBOORU, "555", iqdbMatch)));

        assertEquals(List.of("danbooru:555"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));

        verify(resolver, times(1)).resolve(any(SearchHit.class));
        verify(cacheService, times(1)).cacheProviderDataReactive(eq(IMAGE_ID), any());
        verify(cacheService, never()).markImageAsNotFoundReactive(anyString());
    }

    @Test
    void search_notFoundMarkerSkipsEngines() {
        when(cacheService.isImageMarkedAsNotFoundReactive(IMAGE_ID)).thenReturn(Mono.just(true));

        StepVerifier.create(coordinator.search(IMAGE_URL, IMAGE_ID, settings))
            .verifyComplete();

        verify(sauceNao, never()).search(anyString(), anyString());
        verify(iqdb, never()).search(anyString(), anyString());
        assertEquals(1.0, meterRegistry.get("ris.cache.not_found.hits").counter().count());
    }

    @Test
    void search_cachedImageReplaysWithoutResolving() {
        when(cacheService.getCachedProviderDataByImageReactive(IMAGE_ID))
            .thenReturn(Mono.just(List.of(result("danbooru", "danbooru:1"), result("pixiv", "pixiv:2"))));

        assertEquals(List.of("danbooru:1", "pixiv:2"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));

        verifyNoInteractions(resolver);
        verify(sauceNao, never()).search(anyString(), anyString());
    }

    @Test
    void search_cachedReplayHonoursBestResultsOnly() {
        settings.setBestResultsOnly(true);
        when(cacheService.getCachedProviderDataByImageReactive(IMAGE_ID))
            .thenReturn(Mono.just(List.of(result("pixiv", "pixiv:2"), result("danbooru", "danbooru:1"))));

        assertEquals(List.of("danbooru:1"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));
    }

    @Test
    void search_failingEngineDoesNotAffectOthers() {
        when(sauceNao.search(anyString(), anyString()))
            .thenReturn(Flux.error(new SearchTransportException("saucenao", "429 Too Many Requests", null)));
        when(iqdb.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.IQDB, Platform.ZEROCHAN, "9")));

        assertEquals(List.of("zerochan:9"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));

        assertEquals(1.0, meterRegistry.get("ris.engine.failures").tag("engine", "saucenao").counter().count());
    }

    @Test
    void search_failedResolutionIsSkipped() {
        when(sauceNao.search(anyString(), anyString())).thenReturn(Flux.just(
            hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "1"),
            hit(SearchEngineName.SAUCENAO, Platform.PIXIV, "2")));
        when(resolver.resolve(argThat(h -> h != null && h.platform() == Platform.DANBOORU)))
            .thenReturn(Mono.error(new SearchTransportException("danbooru", "timeout", null)));

        assertEquals(List.of("pixiv:2"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));

        verify(cacheService, times(1)).cacheProviderDataReactive(eq(IMAGE_ID), any());
    }

    @Test
    void search_providerCacheHitSkipsResolution() {
        when(sauceNao.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "555")));
        ProviderData cached = result("danbooru", "danbooru:555");
        when(cacheService.getCachedProviderDataReactive("danbooru:555")).thenReturn(Mono.just(cached));

        StepVerifier.create(coordinator.search(IMAGE_URL, IMAGE_ID, settings))
            .expectNext(cached)
            .verifyComplete();

        verifyNoInteractions(resolver);
        verify(cacheService).cacheProviderDataReactive(IMAGE_ID, cached);
    }

    @Test
    void search_noResultsMarksImageNotFound() {
        StepVerifier.create(coordinator.search(IMAGE_URL, IMAGE_ID, settings))
            .verifyComplete();

        verify(cacheService).markImageAsNotFoundReactive(IMAGE_ID);
        verify(sauceNao).search(IMAGE_URL, IMAGE_ID);
        verify(iqdb).search(IMAGE_URL, IMAGE_ID);
    }

    @Test
    void search_cacheDisabledNeverTouchesCache() {
        settings.setCacheEnabled(false);
        when(sauceNao.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "555")));

        assertEquals(List.of("danbooru:555"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));
        UserSettings iqdbOnly = new UserSettings(2L);
        iqdbOnly.setCacheEnabled(false);
        iqdbOnly.setEnabledEngines(Set.of("IQDB"));
        StepVerifier.create(coordinator.search(IMAGE_URL, "img-empty", iqdbOnly))
            .verifyComplete();

        verifyNoInteractions(cacheService);
    }

    @Test
    void search_unavailableCacheDegradesToUncachedSearch() {
        when(cacheService.isImageMarkedAsNotFoundReactive(anyString()))
            .thenReturn(Mono.error(new CacheUnavailableException("Redis unavailable")));
        when(sauceNao.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "555")));

        assertEquals(List.of("danbooru:555"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));

        verify(cacheService, never()).getCachedProviderDataReactive(anyString());
        verify(cacheService, never()).cacheProviderDataReactive(anyString(), any());
        verify(cacheService, never()).markImageAsNotFoundReactive(anyString());
        assertEquals(1.0, meterRegistry.get("ris.cache.unavailable").counter().count());
    }

    @Test
    void search_cacheWriteFailureStillEmitsResults() {
        when(sauceNao.search(anyString(), anyString())).thenReturn(Flux.just(
            hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "1"),
            hit(SearchEngineName.SAUCENAO, Platform.PIXIV, "2")));
        when(cacheService.cacheProviderDataReactive(anyString(), any()))
            .thenReturn(Mono.error(new CacheUnavailableException("Redis unavailable")));

        assertEquals(2, providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)).size());

        verify(cacheService, times(1)).cacheProviderDataReactive(anyString(), any());
    }

    @Test
    void search_onlyEnabledEnginesAreQueried() {
        settings.setEnabledEngines(Set.of("IQDB"));

        StepVerifier.create(coordinator.search(IMAGE_URL, IMAGE_ID, settings))
            .verifyComplete();

        verify(sauceNao, never()).search(anyString(), anyString());
        verify(iqdb).search(IMAGE_URL, IMAGE_ID);
    }

    @Test
    void search_bestResultsOnlyFiltersFreshResults() {
        settings.setBestResultsOnly(true);
        when(sauceNao.search(anyString(), anyString())).thenReturn(Flux.just(
            hit(SearchEngineName.SAUCENAO, Platform.GELBOORU, "3"),
            hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "1"),
            hit(SearchEngineName.SAUCENAO, Platform.PIXIV, "2")));

        assertEquals(List.of("danbooru:1"), providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)));

        verify(cacheService, times(3)).cacheProviderDataReactive(eq(IMAGE_ID), any());
    }

    @Test
    void search_maxResultsCapsOutput() {
        properties.setMaxResults(2);
        when(sauceNao.search(anyString(), anyString())).thenReturn(Flux.just(
            hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "1"),
            hit(SearchEngineName.SAUCENAO, Platform.PIXIV, "2"),
            hit(SearchEngineName.SAUCENAO, Platform.TWITTER, "3")));

        assertEquals(2, providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)).size());
    }

    @Test
    void search_isColdUntilSubscribed() {
        coordinator.search(IMAGE_URL, IMAGE_ID, settings);

        verifyNoInteractions(cacheService, resolver);
        verify(sauceNao, never()).search(anyString(), anyString());
    }

    @Test
    void search_redisLoadingDegradesToUncachedSearch() {
        FakeRedis redis = new FakeRedis();
        redis.failWith(new JedisDataException("LOADING Redis is loading the dataset in memory"));
        ObjectMapper objectMapper = new ObjectMapper();
        SearchCacheService realCache = new SearchCacheService(redis.jedis(),
            new TypedCacheStore(redis.jedis(), new CacheValueCodec(objectMapper)), objectMapper, properties);
        SearchCoordinator withRedis = new SearchCoordinator(List.of(sauceNao, iqdb), resolver, realCache, new PriorityFilter(),
            properties, new SearchMetricsService(meterRegistry));
        when(sauceNao.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "555")));

        assertEquals(List.of("danbooru:555"), providerIds(withRedis.search(IMAGE_URL, IMAGE_ID, settings)));

        assertEquals(1.0, meterRegistry.get("ris.cache.unavailable").counter().count());
        assertTrue(redis.commands().isEmpty());
    }

    @Test
    void search_resolutionConcurrencyIsBounded() {
        properties.setResolverConcurrency(2);
        when(sauceNao.search(anyString(), anyString())).thenReturn(Flux.range(1, 6)
            .map(i -> hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, String.valueOf(i))));
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        when(resolver.resolve(any(SearchHit.class))).thenAnswer(invocation -> {
            SearchHit hit = invocation.getArgument(0);
            return Mono.delay(Duration.ofMillis(40))
                .map(tick -> result(hit))
                .doOnSubscribe(subscription -> peak.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                .doFinally(signal -> inFlight.decrementAndGet());
        });

        assertEquals(6, providerIds(coordinator.search(IMAGE_URL, IMAGE_ID, settings)).size());

        assertEquals(2, peak.get());
        verify(resolver, times(6)).resolve(any(SearchHit.class));
    }

    @Test
    void search_cancellationStopsPendingResolutionWithoutCaching() {
        when(sauceNao.search(anyString(), anyString()))
            .thenReturn(Flux.just(hit(SearchEngineName.SAUCENAO, Platform.DANBOORU, "555")));
        AtomicBoolean resolutionCancelled = new AtomicBoolean();
        when(resolver.resolve(any(SearchHit.class)))
            .thenReturn(Mono.<ProviderData>never().doOnCancel(() -> resolutionCancelled.set(true)));

        StepVerifier.create(coordinator.search(IMAGE_URL, IMAGE_ID, settings))
            .expectSubscription()
            .expectNoEvent(Duration.ofMillis(100))
            .thenCancel()
            .verify();

        assertTrue(resolutionCancelled.get());
        verify(resolver).resolve(any(SearchHit.class));
        verify(cacheService, never()).cacheProviderDataReactive(anyString(), any());
        verify(cacheService, never()).markImageAsNotFoundReactive(anyString());
    }
}
