package com.videoscout.suggestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * 모든 일자 경계(쿼터 리셋, 만료, 최신성 점수)는 UTC 기준으로 계산합니다.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
