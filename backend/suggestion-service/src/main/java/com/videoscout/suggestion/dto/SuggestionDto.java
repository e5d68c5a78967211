package com.videoscout.suggestion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.videoscout.suggestion.entity.Suggestion;
import com.videoscout.suggestion.entity.SuggestionStatus;
import com.videoscout.suggestion.entity.Video;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SuggestionDto {

    private Long id;
    private String youtubeVideoId;
    private String title;
    private String channelName;
    private String thumbnailUrl;
    private Long durationSeconds;
    private LocalDateTime publishedAt;
    private String reason;
    private SuggestionStatus status;
    private LocalDateTime createdAt;
    private LocalDateTime expiresAt;

    /** Only present right after generation; scores are not stored */
    private Double score;

    /**
     * Video and channel must be loaded.
     */
    public static SuggestionDto from(Suggestion suggestion, int expiryDays) {
        Video video = suggestion.getVideo();
        return SuggestionDto.builder()
                .id(suggestion.getId())
                .youtubeVideoId(video.getYoutubeVideoId())
                .title(video.getTitle())
                .channelName(video.getChannel() != null ? video.getChannel().getName() : null)
                .thumbnailUrl(video.getThumbnailUrl())
                .durationSeconds(video.getDurationSeconds())
                .publishedAt(video.getPublishedAt())
                .reason(suggestion.getReason())
                .status(suggestion.getStatus())
                .createdAt(suggestion.getCreatedAt())
                .expiresAt(suggestion.expiresAt(expiryDays))
                .build();
    }

    /**
     * 방금 저장된 추천. 영상 정보는 엔티티 대신 탐색 결과에서 가져옵니다 (세션 밖에서 호출됨).
     */
    public static SuggestionDto created(Suggestion suggestion, CandidateVideo video, double score, int expiryDays) {
        return SuggestionDto.builder()
                .id(suggestion.getId())
                .youtubeVideoId(video.getVideoId())
                .title(video.getTitle())
                .channelName(video.getChannelName())
                .thumbnailUrl(video.getThumbnailUrl())
                .durationSeconds(video.getDurationSeconds())
                .publishedAt(video.getPublishedAt())
                .reason(suggestion.getReason())
                .status(suggestion.getStatus())
                .createdAt(suggestion.getCreatedAt())
                .expiresAt(suggestion.expiresAt(expiryDays))
                .score(score)
                .build();
    }
}
