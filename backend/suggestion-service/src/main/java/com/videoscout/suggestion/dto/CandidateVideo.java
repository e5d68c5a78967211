package com.videoscout.suggestion.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * A video as returned by the YouTube API, before scoring. Counters default to zero when
 * detail enrichment was not possible.
 */
@Value
@Builder(toBuilder = true)
public class CandidateVideo {

    String videoId;
    String title;
    String channelId;
    String channelName;
    LocalDateTime publishedAt;

    @Builder.Default
    long viewCount = 0L;

    @Builder.Default
    long likeCount = 0L;

    @Builder.Default
    long commentCount = 0L;

    @Builder.Default
    long durationSeconds = 0L;

    String thumbnailUrl;
    String description;

    /**
     * Overlay statistics and duration from a videos.list result; search snippet fields are kept
     * unless they are missing here.
     */
    public CandidateVideo enrichWith(CandidateVideo details) {
        return toBuilder()
                .title(title != null ? title : details.getTitle())
                .channelName(channelName != null ? channelName : details.getChannelName())
                .description(description != null && !description.isBlank() ? description : details.getDescription())
                .thumbnailUrl(thumbnailUrl != null ? thumbnailUrl : details.getThumbnailUrl())
                .viewCount(details.getViewCount())
                .likeCount(details.getLikeCount())
                .commentCount(details.getCommentCount())
                .durationSeconds(details.getDurationSeconds())
                .build();
    }
}
