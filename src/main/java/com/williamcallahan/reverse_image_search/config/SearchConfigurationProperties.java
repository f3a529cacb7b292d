/**
 * Search pipeline configuration properties
 *
 * @author William Callahan
 *
 * Features:
 * - Resolution concurrency bound and result cap for the coordinator
 * - Negative cache lifetime
 * - Per-engine base URLs, credentials and similarity threshold
 * - User agents sent to engines and provider sites
 */

package com.williamcallahan.reverse_image_search.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ris.search")
public class SearchConfigurationProperties {

    private int resolverConcurrency = 8;
    private Duration notFoundTtl = Duration.ofHours(24);
    private int maxResults = 0;
    private Duration searchTimeout = Duration.ofSeconds(60);
    private String defaultUserAgent = "reverse_image_search_bot/3.0";
    private String browserUserAgent = "Mozilla/5.0 (X11; Linux x86_64; rv:128.0) Gecko/20100101 Firefox/128.0";

    @NestedConfigurationProperty
    private SauceNao saucenao = new SauceNao();

    @NestedConfigurationProperty
    private Iqdb iqdb = new Iqdb();

    public int getResolverConcurrency() { return resolverConcurrency; }
    public void setResolverConcurrency(int resolverConcurrency) { this.resolverConcurrency = resolverConcurrency; }

    public Duration getNotFoundTtl() { return notFoundTtl; }
    public void setNotFoundTtl(Duration notFoundTtl) { this.notFoundTtl = notFoundTtl; }

    public int getMaxResults() { return maxResults; }
    public void setMaxResults(int maxResults) { this.maxResults = maxResults; }

    public Duration getSearchTimeout() { return searchTimeout; }
    public void setSearchTimeout(Duration searchTimeout) { this.searchTimeout = searchTimeout; }

    public String getDefaultUserAgent() { return defaultUserAgent; }
    public void setDefaultUserAgent(String defaultUserAgent) { this.defaultUserAgent = defaultUserAgent; }

    public String getBrowserUserAgent() { return browserUserAgent; }
    public void setBrowserUserAgent(String browserUserAgent) { this.browserUserAgent = browserUserAgent; }

    public SauceNao getSaucenao() { return saucenao; }
    public void setSaucenao(SauceNao saucenao) { this.saucenao = saucenao; }

    public Iqdb getIqdb() { return iqdb; }
    public void setIqdb(Iqdb iqdb) { this.iqdb = iqdb; }

    public static class SauceNao {
        private String baseUrl = "https://saucenao.com";
        private String apiKey;
        private double minSimilarity = 60.0;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public double getMinSimilarity() { return minSimilarity; }
        public void setMinSimilarity(double minSimilarity) { this.minSimilarity = minSimilarity; }
    }

    public static class Iqdb {
        private String baseUrl = "https://iqdb.org";

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    }
}
