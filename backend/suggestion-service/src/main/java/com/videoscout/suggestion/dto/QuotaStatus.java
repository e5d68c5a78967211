package com.videoscout.suggestion.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Value
@Builder
public class QuotaStatus {

    LocalDate date;
    long used;
    long reserved;
    long limit;
    long remaining;
    double usedFraction;
    boolean nearLimit;
    boolean critical;
    LocalDateTime lastReset;
    LocalDateTime resetsAt;
}
