package com.videoscout.suggestion.service;

import com.videoscout.suggestion.dto.NotificationEventDto;
import com.videoscout.suggestion.dto.NotificationEventDto.EventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * 사용자 알림 서비스.
 * 파이프라인은 알림 실패로 중단되지 않아야 하므로 모든 발행 오류는 로그만 남깁니다.
 */
@Service
@Slf4j
public class NotificationService {

    private static final DateTimeFormatter RESET_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm 'UTC'");

    private static final int BUFFER_SIZE = 256;

    private final Sinks.Many<NotificationEventDto> eventSink;

    public NotificationService() {
        // autoCancel=false: 마지막 구독자가 끊겨도 싱크는 유지
        this.eventSink = Sinks.many().multicast().onBackpressureBuffer(BUFFER_SIZE, false);
    }

    /**
     * 알림 스트림을 구독합니다.
     */
    public Flux<NotificationEventDto> getEventStream() {
        return eventSink.asFlux()
                .doOnSubscribe(sub -> log.debug("New subscriber connected to notification stream"))
                .doOnCancel(() -> log.debug("Subscriber disconnected from notification stream"));
    }

    /**
     * 일일 한도 소진 알림
     */
    public void notifyQuotaLimit(String resourceName, LocalDateTime resetTime) {
        String resetText = resetTime != null ? resetTime.format(RESET_FORMAT) : "tomorrow";
        publish(NotificationEventDto.quotaLimit(
                resourceName,
                resourceName + " daily limit reached. Suggestions will resume after " + resetText + ".",
                Map.of("resetsAt", resetText)));
    }

    public void notifyWarning(String message) {
        publish(NotificationEventDto.of(EventType.WARNING, message));
    }

    public void notifyInfo(String message) {
        publish(NotificationEventDto.of(EventType.INFO, message));
    }

    public void notifySuccess(String message) {
        publish(NotificationEventDto.of(EventType.SUCCESS, message));
    }

    public void notifyError(String message) {
        publish(NotificationEventDto.of(EventType.ERROR, message));
    }

    private void publish(NotificationEventDto event) {
        try {
            Sinks.EmitResult result = eventSink.tryEmitNext(event);
            if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
                log.warn("Notification not delivered ({}): {}", result, event.getMessage());
            } else {
                log.debug("Published {} notification: {}", event.getEventType(), event.getMessage());
            }
        } catch (Exception e) {
            log.warn("Failed to publish notification: {}", e.getMessage());
        }
    }
}
