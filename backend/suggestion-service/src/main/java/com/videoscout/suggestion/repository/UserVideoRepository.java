package com.videoscout.suggestion.repository;

import com.videoscout.suggestion.entity.UserVideo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface UserVideoRepository extends JpaRepository<UserVideo, Long> {

    boolean existsByUserIdAndVideoId(String userId, Long videoId);
}
