package com.videoscout.suggestion.dto;

import com.videoscout.suggestion.entity.ApiCallRecord;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
public class QuotaUsageStatistics {

    QuotaStatus status;
    long totalCalls;
    long failedCalls;
    Map<String, OperationStats> operations;
    List<ApiCallRecord> recentCalls;

    public record OperationStats(long calls, long errors, long quotaUsed, double averageDurationMs) {
    }
}
