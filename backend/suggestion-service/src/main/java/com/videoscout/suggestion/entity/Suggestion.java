package com.videoscout.suggestion.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * A scored recommendation awaiting the user's decision.
 *
 * activeKey is "userId:youtubeVideoId" while the suggestion is pending and null otherwise,
 * so the unique constraint allows at most one active suggestion per user and video.
 */
@Entity
@Table(name = "suggestions",
    uniqueConstraints = @UniqueConstraint(name = "uk_suggestion_active_key", columnNames = "active_key"),
    indexes = {
        @Index(name = "idx_suggestion_user_status", columnList = "user_id, status"),
        @Index(name = "idx_suggestion_created", columnList = "created_at")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Suggestion {

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

    @Column(name = "reason", nullable = false, length = 500)
    private String reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private SuggestionStatus status = SuggestionStatus.PENDING;

    @Column(name = "is_deleted", nullable = false)
    @Builder.Default
    private Boolean deleted = false;

    @Column(name = "active_key", length = 128)
    private String activeKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "last_modified_at")
    private LocalDateTime lastModifiedAt;

    public static String activeKeyOf(String userId, String youtubeVideoId) {
        return userId + ":" + youtubeVideoId;
    }

    public boolean isPending() {
        return status == SuggestionStatus.PENDING && !Boolean.TRUE.equals(deleted);
    }

    public boolean isExpired(LocalDateTime cutoff) {
        return isPending() && !createdAt.isAfter(cutoff);
    }

    public LocalDateTime expiresAt(int expiryDays) {
        return createdAt.plusDays(expiryDays);
    }

    public void approve(LocalDateTime when) {
        this.status = SuggestionStatus.APPROVED;
        this.activeKey = null;
        this.lastModifiedAt = when;
    }

    public void deny(LocalDateTime when) {
        this.status = SuggestionStatus.DENIED;
        this.activeKey = null;
        this.lastModifiedAt = when;
    }
}
