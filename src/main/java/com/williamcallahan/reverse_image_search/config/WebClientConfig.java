/**
 * Configuration for the shared WebClient used by search engines and providers
 * - Defines the WebClient bean with default timeouts and buffer size
 *
 * @author William Callahan
 */
package com.williamcallahan.reverse_image_search.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

@Configuration
public class WebClientConfig {

    /**
     * Creates the WebClient shared by every engine adapter and provider
     * - Connection timeout 10000ms, read/write/response timeouts 20 seconds
     * - 10MB in-memory buffer for large SauceNAO and booru payloads
     * - Default User-Agent from configuration, overridable per request
     *
     * @param properties search configuration
     * @return A WebClient instance
     */
    @Bean
    public WebClient searchWebClient(SearchConfigurationProperties properties) {
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(20, TimeUnit.SECONDS))
                .addHandlerLast(new WriteTimeoutHandler(20, TimeUnit.SECONDS))
            )
            .followRedirect(true)
            .responseTimeout(Duration.ofSeconds(20));

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(10 * 1024 * 1024)) // 10MB
            .build();

        return WebClient.builder()
            .exchangeStrategies(exchangeStrategies)
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getDefaultUserAgent())
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
