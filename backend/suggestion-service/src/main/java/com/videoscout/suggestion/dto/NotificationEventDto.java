package com.videoscout.suggestion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 사용자 알림 이벤트 DTO.
 * SSE를 통해 클라이언트에 전송됩니다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NotificationEventDto {

    private EventType eventType;

    @Builder.Default
    private Instant timestamp = Instant.now();

    private String message;

    private Map<String, Object> data;

    public enum EventType {
        HEARTBEAT,      // 연결 유지용 하트비트
        QUOTA_LIMIT,    // 일일 쿼터 소진
        WARNING,
        INFO,
        SUCCESS,
        ERROR
    }

    public static NotificationEventDto heartbeat() {
        return NotificationEventDto.builder()
                .eventType(EventType.HEARTBEAT)
                .message("Connection alive")
                .build();
    }

    public static NotificationEventDto quotaLimit(String resourceName, String message, Map<String, Object> data) {
        return NotificationEventDto.builder()
                .eventType(EventType.QUOTA_LIMIT)
                .message(message)
                .data(Map.of("resource", resourceName, "details", data))
                .build();
    }

    public static NotificationEventDto of(EventType type, String message) {
        return NotificationEventDto.builder()
                .eventType(type)
                .message(message)
                .build();
    }
}
