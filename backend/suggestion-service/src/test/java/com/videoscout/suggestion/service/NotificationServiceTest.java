package com.videoscout.suggestion.service;

import com.videoscout.suggestion.dto.NotificationEventDto;
import com.videoscout.suggestion.dto.NotificationEventDto.EventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class NotificationServiceTest {

    private final NotificationService notificationService = new NotificationService();

    @Test
    @DisplayName("구독자는 발행된 알림을 순서대로 받는다")
    void streamsNotifications() {
        StepVerifier.create(notificationService.getEventStream().take(2))
                .then(() -> {
                    notificationService.notifyQuotaLimit(QuotaLedgerService.RESOURCE_NAME,
                            LocalDateTime.of(2024, 3, 11, 0, 0));
                    notificationService.notifySuccess("Generated 3 new suggestions from 10 videos discovered");
                })
                .assertNext(event -> {
                    assertThat(event.getEventType()).isEqualTo(EventType.QUOTA_LIMIT);
                    assertThat(event.getMessage()).contains("2024-03-11 00:00 UTC");
                    assertThat(event.getData()).containsEntry("resource", "YouTube API");
                })
                .assertNext(event -> assertThat(event.getEventType()).isEqualTo(EventType.SUCCESS))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("구독자가 없어도 발행은 실패하지 않는다")
    void publishWithoutSubscribers() {
        assertThatCode(() -> {
            notificationService.notifyWarning("warn");
            notificationService.notifyInfo("info");
            notificationService.notifyError("error");
        }).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("마지막 구독자가 끊겨도 새 구독자는 알림을 받는다")
    void survivesResubscription() {
        StepVerifier.create(notificationService.getEventStream().take(1))
                .then(() -> notificationService.notifyInfo("first"))
                .expectNextMatches(event -> "first".equals(event.getMessage()))
                .verifyComplete();

        StepVerifier.create(notificationService.getEventStream().take(1))
                .then(() -> notificationService.notifyInfo("second"))
                .expectNextMatches(event -> "second".equals(event.getMessage()))
                .verifyComplete();
    }

    @Test
    @DisplayName("하트비트 이벤트")
    void heartbeat() {
        NotificationEventDto heartbeat = NotificationEventDto.heartbeat();
        assertThat(heartbeat.getEventType()).isEqualTo(EventType.HEARTBEAT);
        assertThat(heartbeat.getTimestamp()).isNotNull();
    }
}
