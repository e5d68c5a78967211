package com.videoscout.suggestion.repository;

import com.videoscout.suggestion.entity.ChannelRating;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ChannelRatingRepository extends JpaRepository<ChannelRating, Long> {

    @Query("SELECT r FROM ChannelRating r JOIN FETCH r.channel WHERE r.userId = :userId")
    List<ChannelRating> findByUserIdWithChannel(@Param("userId") String userId);
}
