package com.videoscout.suggestion.scheduler;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.service.QuotaLedgerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * YouTube 쿼터 일일 초기화 스케줄러.
 *
 * - 매일 UTC 자정: 장부 초기화
 * - 워치독 (1분 tick): 날짜 경계 확인 + 임계치 알림. 자정 작업이 누락돼도 다음 점검에서 초기화됩니다.
 *
 * 점검이 실패하면 예외를 로그로 남기고 다음 점검을 지수적으로 늦춥니다 (initial-backoff부터 max-backoff까지).
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "suggestion.quota.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class QuotaResetScheduler {

    private final QuotaLedgerService quotaLedgerService;
    private final SuggestionProperties.Quota quotaProperties;
    private final Clock clock;

    // 스케줄러 스레드에서만 접근
    private Instant nextCheckAt;
    private Duration currentBackoff;
    private int consecutiveFailures;

    public QuotaResetScheduler(QuotaLedgerService quotaLedgerService,
                               SuggestionProperties properties,
                               Clock clock) {
        this.quotaLedgerService = quotaLedgerService;
        this.quotaProperties = properties.getQuota();
        this.clock = clock;
        this.nextCheckAt = Instant.MIN;
    }

    @Scheduled(cron = "0 0 0 * * *", zone = "UTC")
    public void resetAtMidnight() {
        try {
            // 기록이 먼저 날짜를 넘겼다면 이미 새 날짜의 사용량이므로 지우지 않음
            quotaLedgerService.resetIfNewDay();
        } catch (Exception e) {
            log.error("[QuotaReset] Midnight reset failed, watchdog will retry: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${suggestion.quota.watchdog-tick-ms:60000}",
            initialDelayString = "${suggestion.quota.watchdog-initial-delay-ms:10000}")
    public void watchdogTick() {
        Instant now = clock.instant();
        if (now.isBefore(nextCheckAt)) {
            return;
        }
        checkQuota(now);
    }

    /**
     * 날짜 경계와 임계치를 한 번 점검하고 다음 점검 시각을 정합니다.
     *
     * @return 점검 성공 여부
     */
    boolean checkQuota(Instant now) {
        try {
            if (quotaLedgerService.resetIfNewDay()) {
                log.info("[QuotaReset] Day boundary passed, quota ledger reset by watchdog");
            }
            quotaLedgerService.checkThresholds();

            if (consecutiveFailures > 0) {
                log.info("[QuotaReset] Quota check recovered after {} failure(s)", consecutiveFailures);
            }
            consecutiveFailures = 0;
            currentBackoff = null;
            nextCheckAt = now.plus(quotaProperties.getCheckInterval());
            return true;
        } catch (Exception e) {
            consecutiveFailures++;
            currentBackoff = nextBackoff();
            nextCheckAt = now.plus(currentBackoff);
            log.error("[QuotaReset] Quota check failed ({} in a row), retrying in {}: {}",
                    consecutiveFailures, currentBackoff, e.getMessage(), e);
            return false;
        }
    }

    Instant getNextCheckAt() {
        return nextCheckAt;
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    private Duration nextBackoff() {
        Duration max = quotaProperties.getMaxBackoff();
        if (currentBackoff == null) {
            Duration initial = quotaProperties.getInitialBackoff();
            return initial.compareTo(max) > 0 ? max : initial;
        }
        Duration doubled = currentBackoff.multipliedBy(2);
        return doubled.compareTo(max) > 0 ? max : doubled;
    }
}
