package com.videoscout.suggestion.service;

import com.videoscout.suggestion.entity.Topic;
import com.videoscout.suggestion.repository.TopicRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class TopicService {

    private final TopicRepository topicRepository;

    /**
     * 사용자의 관심 토픽 목록 조회
     */
    public List<Topic> getUserTopics(String userId) {
        return topicRepository.findByUserIdOrderByNameAsc(userId);
    }
}
