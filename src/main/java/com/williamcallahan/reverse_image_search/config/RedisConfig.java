/**
 * Redis configuration for the reverse image search cache using Jedis directly
 *
 * @author William Callahan
 *
 * Features:
 * - Configures the Redis connection from spring.redis.* or a REDIS_SERVER URL
 * - Handles SSL connections and passwords embedded in the URL
 * - Connection pooling sized for bounded-elastic workers
 * - Starts even when Redis is down so searches can run uncached
 */

package com.williamcallahan.reverse_image_search.config;

import org.apache.commons.pool2.impl.GenericObjectPoolConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import redis.clients.jedis.Connection;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;

@Configuration
public class RedisConfig {

    private static final Logger logger = LoggerFactory.getLogger(RedisConfig.class);

    @Value("${spring.redis.host:localhost}")
    private String redisHost;

    @Value("${spring.redis.port:6379}")
    private int redisPort;

    @Value("${spring.redis.password:#{null}}")
    private String redisPassword;

    @Value("${REDIS_SERVER:#{null}}")
    private String redisUrl;

    @Value("${spring.redis.ssl:false}")
    private boolean useSsl;

    @Value("${spring.redis.timeout:5000}")
    private int timeout;

    @Value("${spring.redis.jedis.pool.max-active:16}")
    private int maxActive;

    @Value("${spring.redis.jedis.pool.max-idle:8}")
    private int maxIdle;

    @Value("${spring.redis.jedis.pool.min-idle:1}")
    private int minIdle;

    @Value("${spring.redis.jedis.pool.max-wait:3000}")
    private int maxWait;

    /**
     * Creates JedisPooled instance for all cache operations
     *
     * @return Configured JedisPooled instance
     */
    @Bean(destroyMethod = "close")
    public JedisPooled jedisPooled() {
        HostAndPort hostAndPort = createHostAndPort();
        DefaultJedisClientConfig clientConfig = createClientConfig();
        GenericObjectPoolConfig<Connection> poolConfig = jedisPoolConfig();

        logger.info("Creating JedisPooled bean: host={}, port={}, pool(maxTotal={}, maxIdle={}, minIdle={}), ssl={}, passwordProvided={}",
            hostAndPort.getHost(), hostAndPort.getPort(),
            poolConfig.getMaxTotal(), poolConfig.getMaxIdle(), poolConfig.getMinIdle(),
            clientConfig.isSsl(), clientConfig.getPassword() != null);

        JedisPooled jedis = new JedisPooled(hostAndPort, clientConfig, poolConfig);
        try {
            String pong = jedis.ping();
            logger.info("Redis ping successful on startup: {}", pong);
        } catch (JedisException e) {
            logger.warn("Redis ping failed on startup, searches will run uncached until it is reachable: {}", e.getMessage());
        }
        return jedis;
    }

    private HostAndPort createHostAndPort() {
        if (redisUrl != null && !redisUrl.isEmpty()) {
            try {
                URI uri = new URI(redisUrl);
                return new HostAndPort(uri.getHost(), uri.getPort() != -1 ? uri.getPort() : 6379);
            } catch (URISyntaxException e) {
                throw new IllegalStateException("Invalid Redis URL: " + maskCredentials(redisUrl), e);
            }
        }
        return new HostAndPort(redisHost, redisPort);
    }

    private DefaultJedisClientConfig createClientConfig() {
        DefaultJedisClientConfig.Builder builder = DefaultJedisClientConfig.builder()
            .connectionTimeoutMillis(timeout)
            .socketTimeoutMillis(timeout);

        String password = extractPassword();
        if (password != null && !password.isEmpty()) {
            builder.password(password);
        }

        boolean effectiveSsl = useSsl || (redisUrl != null && redisUrl.startsWith("rediss://"));
        if (effectiveSsl) {
            builder.ssl(true);
        }

        return builder.build();
    }

    private String extractPassword() {
        if (redisUrl != null && !redisUrl.isEmpty()) {
            try {
                URI uri = new URI(redisUrl);
                if (uri.getUserInfo() != null) {
                    String[] userInfo = uri.getUserInfo().split(":", 2);
                    if (userInfo.length > 1) {
                        return userInfo[1];
                    }
                }
            } catch (URISyntaxException e) {
                logger.warn("Failed to parse Redis URL for password extraction: {}", e.getMessage());
            }
        }
        return redisPassword;
    }

    private GenericObjectPoolConfig<Connection> jedisPoolConfig() {
        GenericObjectPoolConfig<Connection> poolConfig = new GenericObjectPoolConfig<>();
        poolConfig.setMaxTotal(maxActive);
        poolConfig.setMaxIdle(maxIdle);
        poolConfig.setMinIdle(minIdle);
        poolConfig.setTestOnBorrow(true);
        poolConfig.setTestWhileIdle(true);
        poolConfig.setBlockWhenExhausted(true);
        poolConfig.setMaxWait(Duration.ofMillis(maxWait));
        poolConfig.setTimeBetweenEvictionRuns(Duration.ofSeconds(60));
        poolConfig.setMinEvictableIdleDuration(Duration.ofSeconds(120));
        return poolConfig;
    }

    private String maskCredentials(String url) {
        int at = url.indexOf('@');
        int scheme = url.indexOf("://");
        if (at > 0 && scheme > 0 && scheme < at) {
            return url.substring(0, scheme + 3) + "******" + url.substring(at);
        }
        return url;
    }
}
