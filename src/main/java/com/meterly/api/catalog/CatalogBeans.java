package com.meterly.api.catalog;

import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.NonNull;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the catalog package.
 */
@Configuration
class CatalogBeans {

    static final String CACHE_NAME = "catalog_cache";

    @NonNull
    @Bean(name = CACHE_NAME)
    Cache catalogCache(@NonNull CatalogConfiguration config) {
        return new CaffeineCache(CACHE_NAME, Caffeine.newBuilder()
            .expireAfterWrite(config.getCacheTtl())
            .maximumSize(1)
            .recordStats()
            .build());
    }
}
