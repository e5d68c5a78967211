package com.videoscout.suggestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of one generation request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionResult {

    private boolean success;

    /** Short user-facing summary */
    private String message;

    @Builder.Default
    private List<SuggestionDto> suggestions = new ArrayList<>();

    private int totalDiscovered;
    private int trackedChannelCount;
    private int topicSearchCount;
    private int dualSourceCount;

    /** Videos seen by both strategies and merged into one candidate */
    private int duplicatesMerged;

    /** Qualified candidates skipped because an active suggestion already exists */
    private int alreadySuggested;

    private int belowThreshold;
    private int persistenceFailures;

    private double averageScore;

    /** "floor-floor+1" buckets, e.g. "8-9" */
    @Builder.Default
    private Map<String, Integer> scoreDistribution = new TreeMap<>();

    @Builder.Default
    private List<String> warnings = new ArrayList<>();

    private boolean quotaExhausted;

    private QuotaStatus apiUsage;

    private long processingTimeMs;

    public static SuggestionResult failure(String message) {
        return SuggestionResult.builder()
                .success(false)
                .message(message)
                .build();
    }
}
