/**
 * Service for tracking search pipeline metrics
 * Provides counters, gauges, and timers for monitoring
 *
 * @author William Callahan
 */

package com.williamcallahan.reverse_image_search.monitoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
public class SearchMetricsService {

    private final MeterRegistry meterRegistry;

    // Counters
    private final Counter searches;
    private final Counter cachedReplays;
    private final Counter notFoundHits;
    private final Counter notFoundMarks;
    private final Counter cacheUnavailable;

    // Gauges
    private final AtomicInteger activeSearches = new AtomicInteger(0);

    // Timers
    private final Timer searchTimer;

    public SearchMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.searches = Counter.builder("ris.searches")
            .description("Number of searches started")
            .register(meterRegistry);

        this.cachedReplays = Counter.builder("ris.cache.replays")
            .description("Searches answered from cached provider results")
            .register(meterRegistry);

        this.notFoundHits = Counter.builder("ris.cache.not_found.hits")
            .description("Searches short-circuited by the negative cache")
            .register(meterRegistry);

        this.notFoundMarks = Counter.builder("ris.cache.not_found.marks")
            .description("Images recorded as having no match")
            .register(meterRegistry);

        this.cacheUnavailable = Counter.builder("ris.cache.unavailable")
            .description("Searches that ran uncached because Redis was unreachable")
            .register(meterRegistry);

        Gauge.builder("ris.searches.active", activeSearches, AtomicInteger::get)
            .description("Number of searches in flight")
            .register(meterRegistry);

        this.searchTimer = Timer.builder("ris.search.duration")
            .description("End-to-end search duration")
            .register(meterRegistry);
    }

    public void incrementSearches() {
        searches.increment();
    }

    public void incrementCachedReplays() {
        cachedReplays.increment();
    }

    public void incrementNotFoundHits() {
        notFoundHits.increment();
    }

    public void incrementNotFoundMarks() {
        notFoundMarks.increment();
    }

    public void incrementCacheUnavailable() {
        cacheUnavailable.increment();
    }

    public void incrementEngineHits(String engine, long count) {
        meterRegistry.counter("ris.engine.hits", "engine", engine).increment(count);
    }

    public void incrementEngineFailures(String engine) {
        meterRegistry.counter("ris.engine.failures", "engine", engine).increment();
    }

    /**
     * @param outcome one of resolved, cached, empty, failed
     */
    public void incrementResolutions(String outcome) {
        meterRegistry.counter("ris.resolutions", "outcome", outcome).increment();
    }

    public void incrementActiveSearches() {
        activeSearches.incrementAndGet();
    }

    public void decrementActiveSearches() {
        activeSearches.decrementAndGet();
    }

    public Timer.Sample startSearchTimer() {
        return Timer.start(meterRegistry);
    }

    public void stopSearchTimer(Timer.Sample sample) {
        sample.stop(searchTimer);
    }
}
