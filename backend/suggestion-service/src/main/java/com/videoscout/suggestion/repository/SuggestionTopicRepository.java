package com.videoscout.suggestion.repository;

import com.videoscout.suggestion.entity.SuggestionTopic;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SuggestionTopicRepository extends JpaRepository<SuggestionTopic, Long> {

    List<SuggestionTopic> findBySuggestionId(Long suggestionId);

    long countBySuggestionId(Long suggestionId);
}
