package com.videoscout.suggestion.repository;

import com.videoscout.suggestion.entity.Topic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TopicRepository extends JpaRepository<Topic, Long> {

    List<Topic> findByUserIdOrderByNameAsc(String userId);
}
