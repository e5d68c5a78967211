package com.videoscout.suggestion.scheduler;

import com.videoscout.suggestion.service.SuggestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 만료된 대기 추천 정리 (기본 매일 03:30 UTC)
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "suggestion.curation.cleanup-enabled", havingValue = "true", matchIfMissing = true)
public class SuggestionCleanupScheduler {

    private final SuggestionService suggestionService;

    @Scheduled(cron = "${suggestion.curation.cleanup-cron:0 30 3 * * *}", zone = "UTC")
    public void cleanupExpiredSuggestions() {
        log.debug("[SuggestionCleanup] Starting expired suggestion sweep");
        try {
            int removed = suggestionService.cleanupExpired();
            log.info("[SuggestionCleanup] Sweep complete: {} expired suggestions removed", removed);
        } catch (Exception e) {
            log.error("[SuggestionCleanup] Sweep failed: {}", e.getMessage(), e);
        }
    }
}
