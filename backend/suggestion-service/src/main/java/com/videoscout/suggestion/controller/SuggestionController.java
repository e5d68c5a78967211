package com.videoscout.suggestion.controller;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.dto.PageResponse;
import com.videoscout.suggestion.dto.SuggestionActionResult;
import com.videoscout.suggestion.dto.SuggestionAnalytics;
import com.videoscout.suggestion.dto.SuggestionDto;
import com.videoscout.suggestion.dto.SuggestionResult;
import com.videoscout.suggestion.service.SuggestionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * 영상 추천 API.
 * 사용자 식별은 X-User-Id 헤더로 전달됩니다.
 */
@RestController
@RequestMapping("/api/v1/suggestions")
@RequiredArgsConstructor
@Slf4j
public class SuggestionController {

    static final String USER_HEADER = "X-User-Id";

    private final SuggestionService suggestionService;
    private final SuggestionProperties suggestionProperties;

    // ============================================
    // Generation
    // ============================================

    /**
     * 추천 생성. threshold 미지정 시 설정된 기본 임계치를 사용합니다.
     */
    @PostMapping("/generate")
    public ResponseEntity<SuggestionResult> generate(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(required = false) Double threshold
    ) {
        double effective = threshold != null ? threshold : suggestionProperties.getCuration().getDefaultThreshold();
        double maxScore = suggestionProperties.getScoring().maxTotal();
        if (effective < 0 || effective > maxScore) {
            throw new IllegalArgumentException("threshold must be between 0 and " + maxScore);
        }
        log.info("Suggestion generation requested: user={}, threshold={}", userId, effective);
        return ResponseEntity.ok(suggestionService.generate(userId, effective));
    }

    // ============================================
    // Review
    // ============================================

    @GetMapping
    public ResponseEntity<PageResponse<SuggestionDto>> getPendingSuggestions(
            @RequestHeader(USER_HEADER) String userId,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(PageResponse.from(suggestionService.getPendingSuggestions(userId, page, size)));
    }

    @PostMapping("/{id}/approve")
    public ResponseEntity<SuggestionActionResult> approve(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(suggestionService.approve(userId, id));
    }

    @PostMapping("/{id}/deny")
    public ResponseEntity<SuggestionActionResult> deny(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable Long id
    ) {
        return ResponseEntity.ok(suggestionService.deny(userId, id));
    }

    // ============================================
    // Analytics / Maintenance
    // ============================================

    @GetMapping("/analytics")
    public ResponseEntity<SuggestionAnalytics> getAnalytics(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(suggestionService.getAnalytics(userId));
    }

    /**
     * 만료 추천 즉시 정리 (운영용, 일일 스케줄러와 동일 동작)
     */
    @PostMapping("/cleanup")
    public ResponseEntity<Map<String, Object>> cleanup() {
        int removed = suggestionService.cleanupExpired();
        return ResponseEntity.ok(Map.of("removed", removed));
    }
}
