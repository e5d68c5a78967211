package com.videoscout.suggestion.scheduler;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.service.QuotaLedgerService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuotaResetSchedulerTest {

    private static final Instant NOW = Instant.parse("2024-03-10T12:00:00Z");

    @Mock
    private QuotaLedgerService quotaLedgerService;

    private SuggestionProperties properties;
    private QuotaResetScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new SuggestionProperties();
        scheduler = new QuotaResetScheduler(quotaLedgerService, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("자정 작업은 날짜가 바뀐 경우에만 장부를 초기화한다")
    void midnightReset() {
        // when
        scheduler.resetAtMidnight();

        // then
        verify(quotaLedgerService).resetIfNewDay();
        verify(quotaLedgerService, never()).reset();
    }

    @Test
    @DisplayName("자정 초기화 실패는 스케줄러 밖으로 던지지 않는다")
    void midnightResetFailureIsContained() {
        // given
        doThrow(new IllegalStateException("boom")).when(quotaLedgerService).resetIfNewDay();

        // when / then
        assertThatCode(() -> scheduler.resetAtMidnight()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("정상 점검 후에는 check-interval 뒤에 다시 점검한다")
    void healthyCheck() {
        // given
        when(quotaLedgerService.resetIfNewDay()).thenReturn(true);

        // when
        boolean ok = scheduler.checkQuota(NOW);
        scheduler.watchdogTick();

        // then
        assertThat(ok).isTrue();
        assertThat(scheduler.getNextCheckAt()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
        verify(quotaLedgerService, times(1)).resetIfNewDay();
        verify(quotaLedgerService, times(1)).checkThresholds();
    }

    @Test
    @DisplayName("연속 실패 시 백오프가 두 배씩 늘어나 최대값에서 멈춘다")
    void exponentialBackoff() {
        // given
        when(quotaLedgerService.resetIfNewDay()).thenThrow(new IllegalStateException("ledger unavailable"));

        // when / then
        Instant now = NOW;
        Duration[] expected = {
                Duration.ofMinutes(5), Duration.ofMinutes(10), Duration.ofMinutes(20),
                Duration.ofMinutes(40), Duration.ofHours(1), Duration.ofHours(1)
        };
        for (Duration backoff : expected) {
            assertThat(scheduler.checkQuota(now)).isFalse();
            assertThat(scheduler.getNextCheckAt()).isEqualTo(now.plus(backoff));
            now = scheduler.getNextCheckAt();
        }
        assertThat(scheduler.getConsecutiveFailures()).isEqualTo(6);
        verify(quotaLedgerService, never()).checkThresholds();
    }

    @Test
    @DisplayName("회복하면 백오프를 초기화한다")
    void recoveryResetsBackoff() {
        // given
        when(quotaLedgerService.resetIfNewDay())
                .thenThrow(new IllegalStateException("once"))
                .thenThrow(new IllegalStateException("twice"))
                .thenReturn(false);

        // when
        scheduler.checkQuota(NOW);
        scheduler.checkQuota(NOW);
        boolean recovered = scheduler.checkQuota(NOW);

        // then
        assertThat(recovered).isTrue();
        assertThat(scheduler.getConsecutiveFailures()).isZero();
        assertThat(scheduler.getNextCheckAt()).isEqualTo(NOW.plus(Duration.ofMinutes(5)));
    }
}
