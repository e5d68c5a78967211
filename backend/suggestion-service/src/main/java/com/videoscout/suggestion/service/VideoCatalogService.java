package com.videoscout.suggestion.service;

import com.videoscout.suggestion.dto.CandidateVideo;
import com.videoscout.suggestion.entity.Channel;
import com.videoscout.suggestion.entity.Video;
import com.videoscout.suggestion.repository.ChannelRepository;
import com.videoscout.suggestion.repository.VideoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 영상/채널 upsert. 이미 존재하면 비어 있는 필드만 채웁니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VideoCatalogService {

    private final VideoRepository videoRepository;
    private final ChannelRepository channelRepository;

    @Transactional
    public Channel ensureChannelExists(String youtubeChannelId, String name) {
        return channelRepository.findByYoutubeChannelId(youtubeChannelId)
                .map(existing -> {
                    if ((existing.getName() == null || existing.getName().isBlank()) && name != null) {
                        existing.setName(name);
                    }
                    return existing;
                })
                .orElseGet(() -> {
                    log.debug("Creating channel {}", youtubeChannelId);
                    return channelRepository.save(Channel.builder()
                            .youtubeChannelId(youtubeChannelId)
                            .name(name != null && !name.isBlank() ? name : youtubeChannelId)
                            .build());
                });
    }

    @Transactional
    public Video ensureVideoExists(CandidateVideo candidate) {
        return videoRepository.findByYoutubeVideoId(candidate.getVideoId())
                .map(existing -> backfill(existing, candidate))
                .orElseGet(() -> {
                    Channel channel = ensureChannelExists(candidate.getChannelId(), candidate.getChannelName());
                    return videoRepository.save(Video.builder()
                            .youtubeVideoId(candidate.getVideoId())
                            .channel(channel)
                            .title(truncate(isBlank(candidate.getTitle()) ? candidate.getVideoId() : candidate.getTitle(), 500))
                            .description(truncate(candidate.getDescription(), Video.MAX_DESCRIPTION_LENGTH))
                            .thumbnailUrl(candidate.getThumbnailUrl())
                            .durationSeconds(candidate.getDurationSeconds())
                            .viewCount(candidate.getViewCount())
                            .likeCount(candidate.getLikeCount())
                            .commentCount(candidate.getCommentCount())
                            .publishedAt(candidate.getPublishedAt())
                            .build());
                });
    }

    private Video backfill(Video existing, CandidateVideo candidate) {
        if (isBlank(existing.getThumbnailUrl()) && !isBlank(candidate.getThumbnailUrl())) {
            existing.setThumbnailUrl(candidate.getThumbnailUrl());
        }
        if (isBlank(existing.getDescription()) && !isBlank(candidate.getDescription())) {
            existing.setDescription(truncate(candidate.getDescription(), Video.MAX_DESCRIPTION_LENGTH));
        }
        if ((existing.getDurationSeconds() == null || existing.getDurationSeconds() == 0L)
                && candidate.getDurationSeconds() > 0) {
            existing.setDurationSeconds(candidate.getDurationSeconds());
        }
        if (candidate.getViewCount() > 0) {
            existing.setViewCount(candidate.getViewCount());
            existing.setLikeCount(candidate.getLikeCount());
            existing.setCommentCount(candidate.getCommentCount());
        }
        return existing;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
