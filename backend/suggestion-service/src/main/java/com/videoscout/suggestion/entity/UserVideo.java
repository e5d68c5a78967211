package com.videoscout.suggestion.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * Library entry: a video the user has kept.
 */
@Entity
@Table(name = "user_videos",
    uniqueConstraints = @UniqueConstraint(name = "uk_user_video", columnNames = {"user_id", "video_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserVideo {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "video_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Video video;

    @CreationTimestamp
    @Column(name = "added_at", nullable = false, updatable = false)
    private LocalDateTime addedAt;
}
