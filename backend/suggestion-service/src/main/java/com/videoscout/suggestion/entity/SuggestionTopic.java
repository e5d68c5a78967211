package com.videoscout.suggestion.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Records which user topics a suggestion was made for.
 */
@Entity
@Table(name = "suggestion_topics",
    uniqueConstraints = @UniqueConstraint(name = "uk_suggestion_topic", columnNames = {"suggestion_id", "topic_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SuggestionTopic {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "suggestion_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Suggestion suggestion;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "topic_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Topic topic;
}
