package com.example.imagestore.config;

import com.example.imagestore.cache.CaffeineExistenceCache;
import com.example.imagestore.cache.ExistenceCache;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CacheConfig {

    @Bean
    public ExistenceCache thumbnailExistenceCache(ImageProperties properties) {
        return new CaffeineExistenceCache(properties.getThumbnailCacheMaxSize(), Ticker.systemTicker());
    }
}
