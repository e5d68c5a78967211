package com.videoscout.suggestion.repository;

import com.videoscout.suggestion.entity.TrackedChannel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface TrackedChannelRepository extends JpaRepository<TrackedChannel, Long> {

    /**
     * Active tracked channels for a user, channel eagerly loaded
     */
    @Query("SELECT t FROM TrackedChannel t JOIN FETCH t.channel WHERE t.userId = :userId AND t.deleted = false")
    List<TrackedChannel> findActiveByUserId(@Param("userId") String userId);

    /**
     * Stamp last check date for channels whose poll completed
     */
    @Modifying
    @Query("UPDATE TrackedChannel t SET t.lastCheckDate = :checkedAt " +
            "WHERE t.userId = :userId AND t.deleted = false " +
            "AND t.channel.id IN (SELECT c.id FROM Channel c WHERE c.youtubeChannelId IN :youtubeChannelIds)")
    int updateLastCheckDate(@Param("userId") String userId,
                            @Param("youtubeChannelIds") Collection<String> youtubeChannelIds,
                            @Param("checkedAt") LocalDateTime checkedAt);
}
