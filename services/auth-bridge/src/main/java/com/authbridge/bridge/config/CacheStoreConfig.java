package com.authbridge.bridge.config;

import com.authbridge.bridge.infrastructure.cache.CaffeineCacheStore;
import com.authbridge.bridge.infrastructure.cache.RedisCacheStore;
import com.authbridge.credentials.CacheStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Selects the credential cache backend from {@code auth-bridge.cache.type}.
 *
 * <p>{@code redis} shares passwords across replicas; {@code memory} keeps them in this process.
 */
@Configuration
public class CacheStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CacheStoreConfig.class);

    @Bean
    public CacheStore cacheStore(
            AuthBridgeProperties properties, ObjectProvider<StringRedisTemplate> redisTemplate) {
        AuthBridgeProperties.Cache cache = properties.cache();
        log.info("Credential cache: type={} ttl={}", cache.type(), cache.ttl());
        return switch (cache.type()) {
            case REDIS -> new RedisCacheStore(redisTemplate.getObject());
            case MEMORY -> new CaffeineCacheStore(cache.maxSize());
        };
    }
}
