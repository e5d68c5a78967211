package com.videoscout.suggestion.service;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.config.YouTubeApiProperties;
import com.videoscout.suggestion.dto.QuotaCostEstimate;
import com.videoscout.suggestion.dto.QuotaStatus;
import com.videoscout.suggestion.dto.QuotaUsageStatistics;
import com.videoscout.suggestion.dto.QuotaUsageStatistics.OperationStats;
import com.videoscout.suggestion.entity.ApiCallRecord;
import com.videoscout.suggestion.repository.ApiCallRecordRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * YouTube API 일일 쿼터 장부.
 *
 * 모든 변경은 단일 락으로 직렬화됩니다. 진행 중인 호출의 예상 비용은 reserved로 잡아두고
 * 호출 결과가 기록될 때 해제합니다. 날짜가 바뀌면 다음 접근 시 자동으로 초기화됩니다.
 *
 * 임계치 알림 (하루 한 번씩):
 * - near-limit 이상: 로그
 * - critical 이상: 경고 알림
 * - 100%: 한도 소진 알림
 */
@Service
@Slf4j
public class QuotaLedgerService {

    public static final String RESOURCE_NAME = "YouTube API";

    private static final int ALERT_NONE = 0;
    private static final int ALERT_NEAR = 1;
    private static final int ALERT_CRITICAL = 2;
    private static final int ALERT_EXHAUSTED = 3;

    private final YouTubeApiProperties apiProperties;
    private final SuggestionProperties.Quota quotaProperties;
    private final Clock clock;
    private final NotificationService notificationService;
    private final ApiCallRecordRepository apiCallRecordRepository;
    private final MeterRegistry meterRegistry;

    private final Object lock = new Object();

    // guarded by lock
    private LocalDate ledgerDate;
    private long used;
    private long reserved;
    private LocalDateTime lastReset;
    private int alertLevel = ALERT_NONE;
    private final Deque<ApiCallRecord> history = new ArrayDeque<>();
    private final Map<String, OperationAccumulator> operations = new LinkedHashMap<>();

    public QuotaLedgerService(YouTubeApiProperties apiProperties,
                              SuggestionProperties suggestionProperties,
                              Clock clock,
                              NotificationService notificationService,
                              ApiCallRecordRepository apiCallRecordRepository,
                              MeterRegistry meterRegistry) {
        this.apiProperties = apiProperties;
        this.quotaProperties = suggestionProperties.getQuota();
        this.clock = clock;
        this.notificationService = notificationService;
        this.apiCallRecordRepository = apiCallRecordRepository;
        this.meterRegistry = meterRegistry;
        this.ledgerDate = LocalDate.now(clock);
        this.lastReset = LocalDateTime.now(clock);

        Gauge.builder("youtube.quota.used", this, ledger -> ledger.status().getUsed())
                .description("YouTube API quota units used today")
                .register(meterRegistry);
        Gauge.builder("youtube.quota.reserved", this, ledger -> ledger.status().getReserved())
                .description("YouTube API quota units reserved by in-flight calls")
                .register(meterRegistry);
    }

    /**
     * used + reserved + cost 가 일일 한도 이내인지 확인
     */
    public boolean isAvailable(long cost) {
        requireNonNegative(cost);
        synchronized (lock) {
            rolloverIfNewDay();
            return fits(cost);
        }
    }

    /**
     * 가용하면 cost만큼 예약합니다. 확인과 예약이 하나의 임계 구역에서 이루어집니다.
     */
    public boolean tryReserve(long cost) {
        requireNonNegative(cost);
        synchronized (lock) {
            rolloverIfNewDay();
            if (!fits(cost)) {
                return false;
            }
            reserved += cost;
            return true;
        }
    }

    public void release(long cost) {
        requireNonNegative(cost);
        synchronized (lock) {
            reserved = Math.max(0L, reserved - cost);
        }
    }

    /**
     * API 호출 결과를 기록합니다. 네트워크 오류처럼 비용이 발생하지 않은 호출은 cost 0으로 기록합니다.
     */
    public void record(long cost, String operation, boolean success, long durationMs,
                       String error, Integer itemCount) {
        requireNonNegative(cost);
        LocalDateTime now = LocalDateTime.now(clock);
        ApiCallRecord callRecord = ApiCallRecord.builder()
                .operation(operation)
                .cost((int) cost)
                .durationMs(durationMs)
                .success(success)
                .errorMessage(truncate(error))
                .itemCount(itemCount)
                .calledAt(now)
                .build();

        synchronized (lock) {
            rolloverIfNewDay();
            used += cost;
            history.addLast(callRecord);
            while (history.size() > quotaProperties.getHistorySize()) {
                history.removeFirst();
            }
            operations.computeIfAbsent(operation, k -> new OperationAccumulator())
                    .add(cost, success, durationMs);
        }

        Counter.builder("youtube.api.calls")
                .tag("operation", operation)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .increment();

        if (success) {
            log.debug("API call {} cost={} items={} in {}ms", operation, cost, itemCount, durationMs);
        } else {
            log.warn("API call {} failed (cost={}, {}ms): {}", operation, cost, durationMs, error);
        }

        persist(callRecord);
        checkThresholds();
    }

    /**
     * 사용량과 예약량을 0으로 초기화합니다.
     */
    public void reset() {
        synchronized (lock) {
            resetLocked();
        }
        log.info("YouTube API quota reset at {}", lastResetSnapshot());
    }

    /**
     * UTC 기준 날짜가 바뀐 경우에만 초기화합니다. 같은 날 여러 번 호출해도 안전합니다.
     *
     * @return 초기화가 수행되었으면 true
     */
    public boolean resetIfNewDay() {
        boolean rolled;
        synchronized (lock) {
            rolled = rolloverIfNewDay();
        }
        if (rolled) {
            log.info("YouTube API quota rolled over to {}", LocalDate.now(clock));
        }
        return rolled;
    }

    /**
     * 현재 쿼터 상태. 날짜가 바뀌었지만 아직 초기화되지 않았다면 새 날짜 기준 값을 보여줄 뿐 상태를 바꾸지 않습니다.
     */
    public QuotaStatus status() {
        long limit = apiProperties.getDailyQuotaLimit();
        LocalDate today = LocalDate.now(clock);
        long usedNow;
        long reservedNow;
        LocalDateTime lastResetNow;
        synchronized (lock) {
            boolean stale = !today.equals(ledgerDate);
            usedNow = stale ? 0L : used;
            reservedNow = stale ? 0L : reserved;
            lastResetNow = lastReset;
        }
        double fraction = limit > 0 ? (double) (usedNow + reservedNow) / limit : 0.0;
        return QuotaStatus.builder()
                .date(today)
                .used(usedNow)
                .reserved(reservedNow)
                .limit(limit)
                .remaining(Math.max(0L, limit - usedNow - reservedNow))
                .usedFraction(fraction)
                .nearLimit(fraction >= quotaProperties.getNearLimitFraction())
                .critical(fraction >= quotaProperties.getCriticalFraction())
                .lastReset(lastResetNow)
                .resetsAt(today.plusDays(1).atStartOfDay())
                .build();
    }

    /**
     * 임계치 알림. 같은 날 같은 단계는 한 번만 알립니다.
     */
    public void checkThresholds() {
        QuotaStatus status = status();
        int level = status.getUsed() >= status.getLimit() ? ALERT_EXHAUSTED
                : status.isCritical() ? ALERT_CRITICAL
                : status.isNearLimit() ? ALERT_NEAR
                : ALERT_NONE;

        int previous;
        synchronized (lock) {
            previous = alertLevel;
            if (level <= previous) {
                return;
            }
            alertLevel = level;
        }

        long percent = Math.round(status.getUsedFraction() * 100);
        if (level >= ALERT_NEAR && previous < ALERT_NEAR) {
            log.info("YouTube API quota at {}% ({}/{})", percent, status.getUsed(), status.getLimit());
        }
        if (level >= ALERT_CRITICAL && previous < ALERT_CRITICAL) {
            notificationService.notifyWarning(
                    "YouTube API quota is at " + percent + "%. New suggestions may be limited until the daily reset.");
        }
        if (level >= ALERT_EXHAUSTED) {
            notificationService.notifyQuotaLimit(RESOURCE_NAME, status.getResetsAt());
        }
    }

    public QuotaUsageStatistics usageStatistics() {
        Map<String, OperationStats> ops = new LinkedHashMap<>();
        List<ApiCallRecord> recent;
        long calls = 0;
        long failed = 0;
        synchronized (lock) {
            for (Map.Entry<String, OperationAccumulator> entry : operations.entrySet()) {
                OperationAccumulator acc = entry.getValue();
                ops.put(entry.getKey(), acc.snapshot());
                calls += acc.calls;
                failed += acc.errors;
            }
            recent = new ArrayList<>(history);
        }
        int recentLimit = Math.min(recent.size(), 20);
        return QuotaUsageStatistics.builder()
                .status(status())
                .totalCalls(calls)
                .failedCalls(failed)
                .operations(ops)
                .recentCalls(List.copyOf(recent.subList(recent.size() - recentLimit, recent.size())))
                .build();
    }

    /**
     * 추천 생성 1회의 예상 쿼터 비용.
     * 검색은 duration 필터마다 1회씩, 상세 조회는 배치 단위로 계산합니다.
     */
    public QuotaCostEstimate estimateSuggestionCost(int channelCount, int topicCount, int estimatedVideos) {
        int searchesPerSource = Math.max(1, apiProperties.getDurationFilters().size());
        long searchCost = (long) apiProperties.getSearchCost() * searchesPerSource;
        long channelCost = channelCount * searchCost;
        long topicCost = topicCount * searchCost;
        int batchSize = Math.max(1, apiProperties.getDetailBatchSize());
        // one detail batch per source call at minimum
        long detailCalls = Math.max((long) Math.ceil((double) estimatedVideos / batchSize),
                (long) (channelCount + topicCount) * searchesPerSource);
        long detailCost = detailCalls * apiProperties.getDetailCost();
        long total = channelCost + topicCost + detailCost;

        QuotaStatus status = status();
        double projected = status.getLimit() > 0
                ? 100.0 * (status.getUsed() + status.getReserved() + total) / status.getLimit()
                : 0.0;

        List<String> hints = new ArrayList<>();
        if (total > status.getRemaining()) {
            hints.add("Estimated cost exceeds remaining quota; results will be partial.");
        }
        if (topicCost > channelCost && topicCount > 5) {
            hints.add("Topic searches dominate the cost; consider fewer or more specific topics.");
        }
        if (channelCount > 20) {
            hints.add("Many channels are due for a check; rating channels spaces out re-polls.");
        }

        return QuotaCostEstimate.builder()
                .channelCount(channelCount)
                .topicCount(topicCount)
                .estimatedVideos(estimatedVideos)
                .channelSearchCost(channelCost)
                .topicSearchCost(topicCost)
                .detailCost(detailCost)
                .totalCost(total)
                .remainingQuota(status.getRemaining())
                .exceedsRemaining(total > status.getRemaining())
                .projectedUsagePercent(projected)
                .hints(hints)
                .build();
    }

    private boolean fits(long cost) {
        return used + reserved + cost <= apiProperties.getDailyQuotaLimit();
    }

    private boolean rolloverIfNewDay() {
        if (LocalDate.now(clock).equals(ledgerDate)) {
            return false;
        }
        resetLocked();
        return true;
    }

    private void resetLocked() {
        used = 0L;
        reserved = 0L;
        ledgerDate = LocalDate.now(clock);
        lastReset = LocalDateTime.now(clock);
        alertLevel = ALERT_NONE;
        operations.clear();
    }

    private LocalDateTime lastResetSnapshot() {
        synchronized (lock) {
            return lastReset;
        }
    }

    private void persist(ApiCallRecord callRecord) {
        try {
            apiCallRecordRepository.save(callRecord);
        } catch (Exception e) {
            log.warn("Failed to persist API call record for {}: {}", callRecord.getOperation(), e.getMessage());
        }
    }

    private static void requireNonNegative(long cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Quota cost must not be negative: " + cost);
        }
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 1000) {
            return error;
        }
        return error.substring(0, 1000);
    }

    private static final class OperationAccumulator {
        private long calls;
        private long errors;
        private long quotaUsed;
        private long totalDurationMs;

        void add(long cost, boolean success, long durationMs) {
            calls++;
            if (!success) {
                errors++;
            }
            quotaUsed += cost;
            totalDurationMs += durationMs;
        }

        OperationStats snapshot() {
            return new OperationStats(calls, errors, quotaUsed, calls == 0 ? 0.0 : (double) totalDurationMs / calls);
        }
    }
}
