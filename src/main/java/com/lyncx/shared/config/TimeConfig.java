package com.lyncx.shared.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneOffset;

/**
 * 全域時間來源
 *
 * Token 簽發 / 驗證、方案到期計算、lastLogin 都從同一個 UTC Clock 取時間，
 * 測試時可替換為 Clock.fixed。
 */
@Configuration
public class TimeConfig {

    @Bean
    public Clock utcClock() {
        return Clock.system(ZoneOffset.UTC);
    }
}
