package com.videoscout.suggestion.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionAnalytics {

    private long total;
    private long approved;
    private long denied;
    private long pending;
    private long expired;
    private LocalDateTime lastGeneratedAt;

    public double getApprovalRate() {
        long decided = approved + denied;
        return decided == 0 ? 0.0 : (double) approved / decided;
    }
}
