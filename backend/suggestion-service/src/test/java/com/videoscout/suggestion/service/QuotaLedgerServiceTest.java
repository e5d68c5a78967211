package com.videoscout.suggestion.service;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.config.YouTubeApiProperties;
import com.videoscout.suggestion.dto.QuotaCostEstimate;
import com.videoscout.suggestion.dto.QuotaStatus;
import com.videoscout.suggestion.dto.QuotaUsageStatistics;
import com.videoscout.suggestion.entity.ApiCallRecord;
import com.videoscout.suggestion.repository.ApiCallRecordRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * QuotaLedgerService 단위 테스트
 */
class QuotaLedgerServiceTest {

    private MutableClock clock;
    private YouTubeApiProperties apiProperties;
    private NotificationService notificationService;
    private ApiCallRecordRepository apiCallRecordRepository;
    private QuotaLedgerService ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-10T12:00:00Z"));
        apiProperties = new YouTubeApiProperties();
        apiProperties.setDailyQuotaLimit(1000);
        notificationService = mock(NotificationService.class);
        apiCallRecordRepository = mock(ApiCallRecordRepository.class);
        ledger = newLedger();
    }

    private QuotaLedgerService newLedger() {
        return new QuotaLedgerService(apiProperties, new SuggestionProperties(), clock, notificationService,
                apiCallRecordRepository, new SimpleMeterRegistry());
    }

    @ParameterizedTest(name = "used={0}, reserved={1}, cost={2} -> {3}")
    @DisplayName("isAvailable은 used + reserved + cost <= limit 일 때만 true")
    @CsvSource({
            "0,    0,   1000, true",
            "0,    0,   1001, false",
            "900,  0,   100,  true",
            "900,  50,  100,  false",
            "500,  400, 100,  true",
            "999,  0,   0,    true",
            "1000, 0,   0,    true",
            "1000, 0,   1,    false"
    })
    void isAvailable(long used, long reserved, long cost, boolean expected) {
        // given
        ledger.record(used, "seed", true, 1, null, 0);
        assertThat(ledger.tryReserve(reserved)).isTrue();

        // when / then
        assertThat(ledger.isAvailable(cost)).isEqualTo(expected);
    }

    @ParameterizedTest(name = "limit={0}, used={1}, reserved={2}, cost={3}")
    @DisplayName("무작위 조합에서도 isAvailable은 used + reserved + cost <= limit 과 일치")
    @MethodSource("randomLedgerStates")
    void isAvailableMatchesArithmetic(long limit, long used, long reserved, long cost) {
        // given
        apiProperties.setDailyQuotaLimit(limit);
        QuotaLedgerService sized = newLedger();
        sized.record(used, "seed", true, 1, null, 0);
        assertThat(sized.tryReserve(reserved)).isTrue();

        // when / then
        assertThat(sized.isAvailable(cost)).isEqualTo(used + reserved + cost <= limit);
    }

    static Stream<Arguments> randomLedgerStates() {
        Random random = new Random(20240310L);
        return Stream.generate(() -> {
            long limit = 1 + random.nextInt(20_000);
            long used = random.nextInt((int) limit + 1);
            long reserved = random.nextInt((int) (limit - used) + 1);
            long headroom = limit - used - reserved;
            // 경계 부근을 자주 고르도록 남은 한도 주변 값을 섞음
            long cost = switch (random.nextInt(4)) {
                case 0 -> headroom;
                case 1 -> headroom + 1;
                case 2 -> Math.max(0, headroom - 1 - random.nextInt(50));
                default -> random.nextInt((int) limit * 2 + 1);
            };
            return Arguments.of(limit, used, reserved, cost);
        }).limit(300);
    }

    @Test
    @DisplayName("음수 비용은 거부한다")
    void negativeCost() {
        assertThatThrownBy(() -> ledger.isAvailable(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ledger.record(-5, "op", true, 0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("예약은 확인과 동시에 잡히고 해제하면 사라진다")
    void reserveAndRelease() {
        // when
        boolean first = ledger.tryReserve(600);
        boolean second = ledger.tryReserve(600);
        ledger.release(600);
        boolean third = ledger.tryReserve(400);

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        assertThat(third).isTrue();
        assertThat(ledger.status().getReserved()).isEqualTo(400);
    }

    @Test
    @DisplayName("동시 예약은 한도를 넘지 않는다")
    void concurrentReservationsNeverExceedLimit() throws Exception {
        // given
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 40; i++) {
            futures.add(pool.submit(() -> {
                start.await();
                if (ledger.tryReserve(100)) {
                    granted.incrementAndGet();
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        assertThat(granted.get()).isEqualTo(10);
        assertThat(ledger.status().getReserved()).isEqualTo(1000);
    }

    @Nested
    @DisplayName("초기화")
    class Reset {

        @Test
        @DisplayName("reset은 사용량과 예약량을 0으로 만들고 마지막 초기화 시각을 남긴다")
        void resetZeroes() {
            // given
            ledger.record(700, "search.topic", true, 5, null, 10);
            ledger.tryReserve(200);
            clock.advanceMinutes(30);

            // when
            ledger.reset();
            ledger.reset();

            // then
            QuotaStatus status = ledger.status();
            assertThat(status.getUsed()).isZero();
            assertThat(status.getReserved()).isZero();
            assertThat(status.getLastReset()).isEqualTo(LocalDateTime.of(2024, 3, 10, 12, 30));
        }

        @Test
        @DisplayName("같은 날에는 resetIfNewDay가 아무것도 하지 않는다")
        void resetIfNewDaySameDay() {
            // given
            ledger.record(300, "search.topic", true, 5, null, 10);

            // when
            boolean rolled = ledger.resetIfNewDay();

            // then
            assertThat(rolled).isFalse();
            assertThat(ledger.status().getUsed()).isEqualTo(300);
        }

        @Test
        @DisplayName("자정 직후 기록이 먼저 날짜를 넘기면 늦게 도는 resetIfNewDay는 새 사용량을 지우지 않는다")
        void lateMidnightResetKeepsNewDayUsage() {
            // given
            ledger.record(900, "search.topic", true, 5, null, 10);
            clock.set(Instant.parse("2024-03-11T00:00:00.100Z"));
            ledger.record(300, "search.topic", true, 5, null, 10);
            clock.set(Instant.parse("2024-03-11T00:00:00.400Z"));

            // when
            boolean rolled = ledger.resetIfNewDay();

            // then
            assertThat(rolled).isFalse();
            assertThat(ledger.status().getUsed()).isEqualTo(300);
        }

        @Test
        @DisplayName("UTC 날짜가 바뀌면 resetIfNewDay가 한 번만 초기화한다")
        void resetIfNewDayNextDay() {
            // given
            ledger.record(300, "search.topic", true, 5, null, 10);
            clock.set(Instant.parse("2024-03-11T00:00:05Z"));

            // when
            boolean first = ledger.resetIfNewDay();
            ledger.record(5, "videos.list", true, 5, null, 50);
            boolean second = ledger.resetIfNewDay();

            // then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(ledger.status().getUsed()).isEqualTo(5);
        }

        @Test
        @DisplayName("status는 날짜가 지나면 0을 보여주지만 장부를 바꾸지 않는다")
        void statusIsSideEffectFree() {
            // given
            ledger.record(300, "search.topic", true, 5, null, 10);
            clock.set(Instant.parse("2024-03-11T08:00:00Z"));

            // when
            QuotaStatus status = ledger.status();

            // then
            assertThat(status.getUsed()).isZero();
            assertThat(status.getResetsAt()).isEqualTo(LocalDateTime.of(2024, 3, 12, 0, 0));
            assertThat(ledger.resetIfNewDay()).isTrue();
        }
    }

    @Nested
    @DisplayName("임계치 알림")
    class Thresholds {

        @Test
        @DisplayName("critical 이상이면 경고를 하루 한 번만 보낸다")
        void criticalWarnsOnce() {
            // when
            ledger.record(960, "search.topic", true, 5, null, 10);
            ledger.record(10, "search.topic", true, 5, null, 10);
            ledger.checkThresholds();

            // then
            assertThat(ledger.status().isCritical()).isTrue();
            verify(notificationService, times(1)).notifyWarning(anyString());
            verify(notificationService, never()).notifyQuotaLimit(anyString(), any());
        }

        @Test
        @DisplayName("한도에 도달하면 한도 소진 알림을 보낸다")
        void exhaustedNotifiesQuotaLimit() {
            // when
            ledger.record(1000, "search.topic", true, 5, null, 10);

            // then
            verify(notificationService).notifyQuotaLimit(eq(QuotaLedgerService.RESOURCE_NAME),
                    eq(LocalDateTime.of(2024, 3, 11, 0, 0)));
        }

        @Test
        @DisplayName("near-limit 구간에서는 알림을 보내지 않는다")
        void nearLimitOnlyLogs() {
            // when
            ledger.record(850, "search.topic", true, 5, null, 10);

            // then
            assertThat(ledger.status().isNearLimit()).isTrue();
            assertThat(ledger.status().isCritical()).isFalse();
            verify(notificationService, never()).notifyWarning(anyString());
        }

        @Test
        @DisplayName("날짜가 바뀌면 알림 단계도 초기화된다")
        void alertLevelResetsDaily() {
            // given
            ledger.record(960, "search.topic", true, 5, null, 10);
            clock.set(Instant.parse("2024-03-11T01:00:00Z"));

            // when
            ledger.record(960, "search.topic", true, 5, null, 10);

            // then
            verify(notificationService, times(2)).notifyWarning(anyString());
        }
    }

    @Test
    @DisplayName("호출 기록은 저장되고, 저장 실패는 장부에 영향을 주지 않는다")
    void recordPersistsAuditTrail() {
        // given
        when(apiCallRecordRepository.save(any(ApiCallRecord.class))).thenThrow(new IllegalStateException("db down"));

        // when
        ledger.record(100, "search.channel", false, 12, "503 Service Unavailable", 0);

        // then
        verify(apiCallRecordRepository).save(any(ApiCallRecord.class));
        assertThat(ledger.status().getUsed()).isEqualTo(100);
    }

    @Test
    @DisplayName("작업별 사용 통계")
    void usageStatistics() {
        // given
        ledger.record(100, "search.topic", true, 20, null, 10);
        ledger.record(0, "search.topic", false, 40, "timeout", 0);
        ledger.record(1, "videos.list", true, 10, null, 50);

        // when
        QuotaUsageStatistics stats = ledger.usageStatistics();

        // then
        assertThat(stats.getTotalCalls()).isEqualTo(3);
        assertThat(stats.getFailedCalls()).isEqualTo(1);
        assertThat(stats.getOperations()).containsOnlyKeys("search.topic", "videos.list");
        assertThat(stats.getOperations().get("search.topic").quotaUsed()).isEqualTo(100);
        assertThat(stats.getOperations().get("search.topic").averageDurationMs()).isEqualTo(30.0);
        assertThat(stats.getRecentCalls()).hasSize(3);
    }

    @Test
    @DisplayName("생성 비용 추정은 필터별 검색과 배치 상세 조회를 합산한다")
    void estimateSuggestionCost() {
        // given
        apiProperties.setDailyQuotaLimit(10_000);

        // when
        QuotaCostEstimate estimate = ledger.estimateSuggestionCost(3, 2, 120);

        // then
        assertThat(estimate.getChannelSearchCost()).isEqualTo(600);
        assertThat(estimate.getTopicSearchCost()).isEqualTo(400);
        assertThat(estimate.getDetailCost()).isEqualTo(10);
        assertThat(estimate.getTotalCost()).isEqualTo(1010);
        assertThat(estimate.isExceedsRemaining()).isFalse();
    }

    /**
     * 테스트용 가변 시계
     */
    static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void set(Instant instant) {
            this.now = instant;
        }

        void advanceMinutes(long minutes) {
            this.now = now.plusSeconds(minutes * 60);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
