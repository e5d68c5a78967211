package com.videoscout.suggestion.controller;

import com.videoscout.suggestion.client.YouTubeApiClient;
import com.videoscout.suggestion.dto.QuotaCostEstimate;
import com.videoscout.suggestion.dto.QuotaUsageStatistics;
import com.videoscout.suggestion.service.QuotaLedgerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * YouTube API 쿼터 조회/운영 API
 */
@RestController
@RequestMapping("/api/v1/quota")
@RequiredArgsConstructor
@Slf4j
public class QuotaController {

    private final QuotaLedgerService quotaLedgerService;
    private final YouTubeApiClient youTubeApiClient;

    /**
     * 쿼터 상태와 API 가용성
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> getStatus() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("quota", quotaLedgerService.status());
        body.put("configured", youTubeApiClient.isConfigured());
        body.put("halted", youTubeApiClient.isHalted());
        body.put("available", youTubeApiClient.isConfigured() && !youTubeApiClient.isHalted()
                && quotaLedgerService.status().getRemaining() > 0);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/usage")
    public ResponseEntity<QuotaUsageStatistics> getUsage() {
        return ResponseEntity.ok(quotaLedgerService.usageStatistics());
    }

    @GetMapping("/estimate")
    public ResponseEntity<QuotaCostEstimate> estimate(
            @RequestParam(defaultValue = "0") int channels,
            @RequestParam(defaultValue = "0") int topics,
            @RequestParam(defaultValue = "0") int videos
    ) {
        if (channels < 0 || topics < 0 || videos < 0) {
            throw new IllegalArgumentException("channels, topics and videos must not be negative");
        }
        return ResponseEntity.ok(quotaLedgerService.estimateSuggestionCost(channels, topics, videos));
    }

    /**
     * 인증 오류로 중단된 API 클라이언트 재개 (API 키 교체 후 호출)
     */
    @PostMapping("/resume")
    public ResponseEntity<Map<String, Object>> resume() {
        boolean wasHalted = youTubeApiClient.isHalted();
        youTubeApiClient.resumeAfterAuthFailure();
        log.info("Quota resume requested (wasHalted={})", wasHalted);
        return ResponseEntity.ok(Map.of("resumed", wasHalted, "halted", youTubeApiClient.isHalted()));
    }
}
