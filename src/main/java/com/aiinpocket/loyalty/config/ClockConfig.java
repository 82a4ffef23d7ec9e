package com.aiinpocket.loyalty.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 系統時鐘。
 * 挑戰有效期間、積分事件時間戳與排行榜週期全部讀取同一個 Clock。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(LoyaltyProperties properties) {
        return Clock.system(ZoneId.of(properties.timeZone()));
    }
}
