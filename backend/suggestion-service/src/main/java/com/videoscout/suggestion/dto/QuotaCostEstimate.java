package com.videoscout.suggestion.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Projected quota cost of a generation request.
 */
@Value
@Builder
public class QuotaCostEstimate {

    int channelCount;
    int topicCount;
    int estimatedVideos;
    long channelSearchCost;
    long topicSearchCost;
    long detailCost;
    long totalCost;
    long remainingQuota;
    boolean exceedsRemaining;
    double projectedUsagePercent;
    List<String> hints;
}
