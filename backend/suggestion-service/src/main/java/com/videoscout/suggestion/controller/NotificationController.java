package com.videoscout.suggestion.controller;

import com.videoscout.suggestion.dto.NotificationEventDto;
import com.videoscout.suggestion.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * 사용자 알림 SSE 스트림.
 *
 * 이벤트: connected (즉시), heartbeat (30초), quota_limit / warning / info / success / error
 */
@RestController
@RequestMapping("/api/v1/notifications")
@RequiredArgsConstructor
@Slf4j
public class NotificationController {

    private static final Duration HEARTBEAT_INTERVAL = Duration.ofSeconds(30);

    private final NotificationService notificationService;

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<NotificationEventDto>> stream() {
        log.info("SSE client connected to notification stream");

        Flux<ServerSentEvent<NotificationEventDto>> connected = Flux.just(
                ServerSentEvent.<NotificationEventDto>builder()
                        .event("connected")
                        .data(NotificationEventDto.heartbeat())
                        .build());

        Flux<ServerSentEvent<NotificationEventDto>> heartbeat = Flux.interval(HEARTBEAT_INTERVAL)
                .map(tick -> ServerSentEvent.<NotificationEventDto>builder()
                        .event("heartbeat")
                        .data(NotificationEventDto.heartbeat())
                        .build());

        Flux<ServerSentEvent<NotificationEventDto>> events = notificationService.getEventStream()
                .map(event -> ServerSentEvent.<NotificationEventDto>builder()
                        .event(event.getEventType().name().toLowerCase())
                        .data(event)
                        .build());

        return Flux.concat(connected, Flux.merge(heartbeat, events))
                .doOnCancel(() -> log.info("SSE client disconnected from notification stream"))
                .doOnError(e -> log.error("Notification stream error", e));
    }
}
