package com.videoscout.suggestion.service;

import com.videoscout.suggestion.entity.UserVideo;
import com.videoscout.suggestion.entity.Video;
import com.videoscout.suggestion.repository.UserVideoRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * 사용자 라이브러리 (승인된 영상 보관함)
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LibraryService {

    private final UserVideoRepository userVideoRepository;

    @Transactional(readOnly = true)
    public boolean isInLibrary(String userId, Video video) {
        return userVideoRepository.existsByUserIdAndVideoId(userId, video.getId());
    }

    /**
     * 호출자의 트랜잭션과 분리해 저장합니다. 실패해도 승인 트랜잭션은 롤백되지 않습니다.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public UserVideo addToLibrary(String userId, Video video) {
        UserVideo saved = userVideoRepository.save(UserVideo.builder()
                .userId(userId)
                .video(video)
                .build());
        log.info("Added video {} to library of user {}", video.getYoutubeVideoId(), userId);
        return saved;
    }
}
