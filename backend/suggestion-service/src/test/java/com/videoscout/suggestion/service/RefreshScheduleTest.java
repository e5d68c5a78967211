package com.videoscout.suggestion.service;

import com.videoscout.suggestion.config.SuggestionProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class RefreshScheduleTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 10, 12, 0);

    private final RefreshSchedule schedule = new RefreshSchedule(new SuggestionProperties());

    @ParameterizedTest(name = "{0}★, checked {1} days ago -> due={2}")
    @DisplayName("별점별 재확인 주기")
    @CsvSource({
            "5, 4,  false",
            "5, 6,  true",
            "5, 5,  true",
            "4, 6,  false",
            "4, 7,  true",
            "3, 9,  false",
            "3, 10, true",
            "2, 13, false",
            "2, 14, true",
            "1, 365, false"
    })
    void isDue(int stars, int daysAgo, boolean expected) {
        assertThat(schedule.isDue(stars, NOW.minusDays(daysAgo), NOW)).isEqualTo(expected);
    }

    @Test
    @DisplayName("한 번도 확인하지 않은 채널은 1점이 아니면 바로 조회한다")
    void neverChecked() {
        assertThat(schedule.isDue(null, null, NOW)).isTrue();
        assertThat(schedule.isDue(3, null, NOW)).isTrue();
        assertThat(schedule.isDue(1, null, NOW)).isFalse();
    }

    @Test
    @DisplayName("평점이 없는 채널은 최초 조회 이후 다시 조회하지 않는다")
    void unratedAfterFirstCheck() {
        assertThat(schedule.isDue(null, NOW.minusDays(100), NOW)).isFalse();
        assertThat(schedule.refreshInterval(null)).isEmpty();
        assertThat(schedule.refreshInterval(5)).contains(Duration.ofDays(5));
    }
}
