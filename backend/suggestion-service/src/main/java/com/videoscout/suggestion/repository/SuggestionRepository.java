package com.videoscout.suggestion.repository;

import com.videoscout.suggestion.entity.Suggestion;
import com.videoscout.suggestion.entity.SuggestionStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * "Active" everywhere below means pending, not soft-deleted and created after the expiry cutoff.
 */
@Repository
public interface SuggestionRepository extends JpaRepository<Suggestion, Long> {

    Optional<Suggestion> findByIdAndUserId(Long id, String userId);

    @Query("SELECT COUNT(s) > 0 FROM Suggestion s " +
            "WHERE s.userId = :userId AND s.video.youtubeVideoId = :youtubeVideoId " +
            "AND s.status = com.videoscout.suggestion.entity.SuggestionStatus.PENDING " +
            "AND s.deleted = false AND s.createdAt > :cutoff")
    boolean existsActive(@Param("userId") String userId,
                         @Param("youtubeVideoId") String youtubeVideoId,
                         @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT COUNT(s) FROM Suggestion s " +
            "WHERE s.userId = :userId AND s.status = com.videoscout.suggestion.entity.SuggestionStatus.PENDING " +
            "AND s.deleted = false AND s.createdAt > :cutoff")
    long countActive(@Param("userId") String userId, @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT s.video.youtubeVideoId FROM Suggestion s " +
            "WHERE s.userId = :userId AND s.status = com.videoscout.suggestion.entity.SuggestionStatus.PENDING " +
            "AND s.deleted = false AND s.createdAt > :cutoff")
    List<String> findActiveVideoIds(@Param("userId") String userId, @Param("cutoff") LocalDateTime cutoff);

    @Query(value = "SELECT s FROM Suggestion s JOIN FETCH s.video v JOIN FETCH v.channel " +
            "WHERE s.userId = :userId AND s.status = com.videoscout.suggestion.entity.SuggestionStatus.PENDING " +
            "AND s.deleted = false AND s.createdAt > :cutoff ORDER BY s.createdAt DESC",
            countQuery = "SELECT COUNT(s) FROM Suggestion s " +
            "WHERE s.userId = :userId AND s.status = com.videoscout.suggestion.entity.SuggestionStatus.PENDING " +
            "AND s.deleted = false AND s.createdAt > :cutoff")
    Page<Suggestion> findActive(@Param("userId") String userId,
                                @Param("cutoff") LocalDateTime cutoff,
                                Pageable pageable);

    /**
     * Soft-delete pending suggestions past the expiry window and release their active keys
     */
    @Modifying
    @Query("UPDATE Suggestion s SET s.deleted = true, s.activeKey = null, s.lastModifiedAt = :now " +
            "WHERE s.status = com.videoscout.suggestion.entity.SuggestionStatus.PENDING " +
            "AND s.deleted = false AND s.createdAt <= :cutoff")
    int expirePending(@Param("cutoff") LocalDateTime cutoff, @Param("now") LocalDateTime now);

    /**
     * Release the active key held by an expired-but-not-yet-swept suggestion
     */
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Suggestion s SET s.deleted = true, s.activeKey = null, s.lastModifiedAt = :now " +
            "WHERE s.activeKey = :activeKey AND s.createdAt <= :cutoff")
    int retireExpiredKey(@Param("activeKey") String activeKey,
                         @Param("cutoff") LocalDateTime cutoff,
                         @Param("now") LocalDateTime now);

    long countByUserId(String userId);

    long countByUserIdAndStatus(String userId, SuggestionStatus status);

    @Query("SELECT COUNT(s) FROM Suggestion s " +
            "WHERE s.userId = :userId AND s.status = com.videoscout.suggestion.entity.SuggestionStatus.PENDING " +
            "AND (s.deleted = true OR s.createdAt <= :cutoff)")
    long countExpired(@Param("userId") String userId, @Param("cutoff") LocalDateTime cutoff);

    @Query("SELECT MAX(s.createdAt) FROM Suggestion s WHERE s.userId = :userId")
    Optional<LocalDateTime> findLastCreatedAt(@Param("userId") String userId);
}
