package com.videoscout.suggestion.service;

import com.videoscout.suggestion.config.SuggestionProperties;
import com.videoscout.suggestion.entity.Suggestion;
import com.videoscout.suggestion.entity.SuggestionStatus;
import com.videoscout.suggestion.entity.SuggestionTopic;
import com.videoscout.suggestion.entity.Video;
import com.videoscout.suggestion.repository.SuggestionRepository;
import com.videoscout.suggestion.repository.SuggestionTopicRepository;
import com.videoscout.suggestion.repository.TopicRepository;
import com.videoscout.suggestion.repository.VideoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * 추천 저장 규칙.
 *
 * 추천 하나와 토픽 링크는 하나의 독립 트랜잭션으로 저장됩니다 (링크 저장 실패 시 추천도 롤백).
 * 사용자/영상당 활성 추천은 active_key 유니크 제약으로 최대 하나만 존재합니다.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SuggestionPersistenceService {

    private final SuggestionRepository suggestionRepository;
    private final SuggestionTopicRepository suggestionTopicRepository;
    private final TopicRepository topicRepository;
    private final VideoRepository videoRepository;
    private final SuggestionProperties properties;
    private final Clock clock;

    @Transactional(readOnly = true)
    public boolean hasActiveSuggestion(String userId, String youtubeVideoId) {
        return suggestionRepository.existsActive(userId, youtubeVideoId, expiryCutoff());
    }

    @Transactional(readOnly = true)
    public long countActiveSuggestions(String userId) {
        return suggestionRepository.countActive(userId, expiryCutoff());
    }

    @Transactional(readOnly = true)
    public Set<String> findActiveVideoIds(String userId) {
        return new HashSet<>(suggestionRepository.findActiveVideoIds(userId, expiryCutoff()));
    }

    /**
     * 토픽 링크 없는 추천 저장
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Suggestion> insertSuggestion(String userId, Video video, String reason) {
        return insertInternal(userId, video, reason, Set.of());
    }

    /**
     * 추천과 토픽 링크를 한 트랜잭션으로 저장합니다.
     *
     * @return 이미 활성 추천이 있으면 empty
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<Suggestion> insertSuggestionWithTopics(String userId, Video video, String reason,
                                                           Collection<Long> topicIds) {
        return insertInternal(userId, video, reason, new LinkedHashSet<>(topicIds));
    }

    /**
     * 만료 기간이 지난 대기 추천을 소프트 삭제합니다.
     */
    @Transactional
    public int cleanupExpired() {
        LocalDateTime now = LocalDateTime.now(clock);
        int removed = suggestionRepository.expirePending(expiryCutoff(), now);
        if (removed > 0) {
            log.info("Expired {} pending suggestions older than {} days", removed,
                    properties.getCuration().getExpiryDays());
        }
        return removed;
    }

    public LocalDateTime expiryCutoff() {
        return LocalDateTime.now(clock).minusDays(properties.getCuration().getExpiryDays());
    }

    private Optional<Suggestion> insertInternal(String userId, Video video, String reason, Set<Long> topicIds) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minusDays(properties.getCuration().getExpiryDays());
        String activeKey = Suggestion.activeKeyOf(userId, video.getYoutubeVideoId());

        // 아직 정리되지 않은 만료 추천이 키를 점유하고 있으면 해제
        int retired = suggestionRepository.retireExpiredKey(activeKey, cutoff, now);
        if (retired > 0) {
            log.debug("Retired {} expired suggestion(s) for {}", retired, activeKey);
        }

        if (suggestionRepository.existsActive(userId, video.getYoutubeVideoId(), cutoff)) {
            log.debug("Active suggestion already exists for {}", activeKey);
            return Optional.empty();
        }

        Suggestion suggestion = suggestionRepository.save(Suggestion.builder()
                .userId(userId)
                .video(videoRepository.getReferenceById(video.getId()))
                .reason(reason)
                .status(SuggestionStatus.PENDING)
                .deleted(false)
                .activeKey(activeKey)
                .createdAt(now)
                .lastModifiedAt(now)
                .build());

        for (Long topicId : topicIds) {
            suggestionTopicRepository.save(SuggestionTopic.builder()
                    .suggestion(suggestion)
                    .topic(topicRepository.getReferenceById(topicId))
                    .build());
        }

        // 제약 위반을 커밋 전에 이 메서드 안에서 드러나게 함
        suggestionRepository.flush();
        log.debug("Saved suggestion {} for {} with {} topic link(s)", suggestion.getId(), activeKey, topicIds.size());
        return Optional.of(suggestion);
    }
}
