package com.videoscout.suggestion.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "channel_ratings",
    uniqueConstraints = @UniqueConstraint(name = "uk_rating_user_channel", columnNames = {"user_id", "channel_id"}))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelRating {

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

    /** 1-5 */
    @Column(name = "stars", nullable = false)
    private Integer stars;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
