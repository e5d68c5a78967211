package com.videoscout.suggestion.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Append-only audit row for every outbound API call.
 */
@Entity
@Table(name = "api_call_records", indexes = {
    @Index(name = "idx_api_call_operation", columnList = "operation"),
    @Index(name = "idx_api_call_called_at", columnList = "called_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiCallRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "operation", nullable = false, length = 50)
    private String operation;

    @Column(name = "quota_cost", nullable = false)
    private Integer cost;

    @Column(name = "duration_ms", nullable = false)
    private Long durationMs;

    @Column(name = "success", nullable = false)
    private Boolean success;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "item_count")
    private Integer itemCount;

    @Column(name = "called_at", nullable = false)
    private LocalDateTime calledAt;
}
