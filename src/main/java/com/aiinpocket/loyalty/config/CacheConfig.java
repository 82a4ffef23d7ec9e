package com.aiinpocket.loyalty.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * 快取配置。
 * 使用 Caffeine 本地快取等級表（靜態設定，執行期不會變動，TTL 10 分鐘）。
 */
@Configuration
@EnableCaching
public class CacheConfig {

    public static final String LEVEL_TABLE_CACHE = "levelTable";

    @Bean
    public CacheManager cacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager(LEVEL_TABLE_CACHE);
        manager.setCaffeine(Caffeine.newBuilder()
                .expireAfterWrite(10, TimeUnit.MINUTES)
                .maximumSize(1));
        return manager;
    }
}
