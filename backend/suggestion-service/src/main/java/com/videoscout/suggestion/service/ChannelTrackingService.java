package com.videoscout.suggestion.service;

import com.videoscout.suggestion.dto.ChannelUpdateRequest;
import com.videoscout.suggestion.entity.ChannelRating;
import com.videoscout.suggestion.entity.TrackedChannel;
import com.videoscout.suggestion.repository.ChannelRatingRepository;
import com.videoscout.suggestion.repository.TrackedChannelRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 추적 채널과 채널 평점 조회
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class ChannelTrackingService {

    private final TrackedChannelRepository trackedChannelRepository;
    private final ChannelRatingRepository channelRatingRepository;
    private final RefreshSchedule refreshSchedule;
    private final Clock clock;

    /**
     * YouTube 채널 id → 별점(1-5)
     */
    public Map<String, Integer> getUserRatings(String userId) {
        Map<String, Integer> ratings = new HashMap<>();
        for (ChannelRating rating : channelRatingRepository.findByUserIdWithChannel(userId)) {
            ratings.put(rating.getChannel().getYoutubeChannelId(), rating.getStars());
        }
        return ratings;
    }

    /**
     * 평점 등급별 재확인 주기가 지난 채널 목록 (1점 채널 제외)
     */
    public List<ChannelUpdateRequest> getChannelsDueForCheck(String userId) {
        Map<String, Integer> ratings = getUserRatings(userId);
        LocalDateTime now = LocalDateTime.now(clock);

        List<ChannelUpdateRequest> due = new ArrayList<>();
        List<TrackedChannel> tracked = trackedChannelRepository.findActiveByUserId(userId);
        for (TrackedChannel trackedChannel : tracked) {
            String channelId = trackedChannel.getChannel().getYoutubeChannelId();
            Integer stars = ratings.get(channelId);
            if (refreshSchedule.isDue(stars, trackedChannel.getLastCheckDate(), now)) {
                due.add(new ChannelUpdateRequest(channelId, trackedChannel.getChannel().getName(),
                        trackedChannel.getLastCheckDate(), stars));
            }
        }
        log.debug("{} of {} tracked channels due for check for user {}", due.size(), tracked.size(), userId);
        return due;
    }

    /**
     * 폴링이 완료된 채널의 마지막 확인 시각 갱신
     */
    @Transactional
    public int markChecked(String userId, Collection<String> youtubeChannelIds, LocalDateTime checkedAt) {
        if (youtubeChannelIds.isEmpty()) {
            return 0;
        }
        return trackedChannelRepository.updateLastCheckDate(userId, youtubeChannelIds, checkedAt);
    }
}
