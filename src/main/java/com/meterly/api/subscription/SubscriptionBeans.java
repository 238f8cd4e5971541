package com.meterly.api.subscription;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.meterly.api.subscription.upstream.StripeApi;
import lombok.NonNull;
import org.springframework.cache.Cache;
import org.springframework.cache.caffeine.CaffeineCache;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Beans used by the subscription package.
 */
@Configuration
class SubscriptionBeans {

    static final String CACHE_NAME = "subscription_cache";

    @NonNull
    @Bean
    StripeApi stripeApi(@NonNull SubscriptionConfiguration config) {
        return new StripeApi(config.getStripeApiKey());
    }

    @NonNull
    @Bean(name = CACHE_NAME)
    Cache cache(@NonNull SubscriptionConfiguration config) {
        return new CaffeineCache(CACHE_NAME, Caffeine.newBuilder()
            .expireAfterWrite(config.getCacheTtl())
            .initialCapacity(100)
            .maximumSize(1000)
            .recordStats()
            .build());
    }
}
