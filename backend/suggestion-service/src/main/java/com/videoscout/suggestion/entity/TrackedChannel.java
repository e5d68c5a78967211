package com.videoscout.suggestion.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * A channel a user follows. lastCheckDate drives the rating-tier re-poll schedule.
 */
@Entity
@Table(name = "tracked_channels",
    uniqueConstraints = @UniqueConstraint(name = "uk_tracked_user_channel", columnNames = {"user_id", "channel_id"}),
    indexes = @Index(name = "idx_tracked_user", columnList = "user_id"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TrackedChannel {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "channel_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Channel channel;

    @Column(name = "last_check_date")
    private LocalDateTime lastCheckDate;

    @Column(name = "is_deleted", nullable = false)
    @Builder.Default
    private Boolean deleted = false;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
