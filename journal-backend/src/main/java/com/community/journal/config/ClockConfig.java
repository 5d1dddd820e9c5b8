package com.community.journal.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * 墙上时钟。每次请求按当前时间计算"昨天"，不依赖定时任务切日。
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(JournalProperties properties) {
        return Clock.system(ZoneId.of(properties.getZone()));
    }
}
