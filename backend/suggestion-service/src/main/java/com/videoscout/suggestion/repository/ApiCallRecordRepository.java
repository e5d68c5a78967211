package com.videoscout.suggestion.repository;

import com.videoscout.suggestion.entity.ApiCallRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;

@Repository
public interface ApiCallRecordRepository extends JpaRepository<ApiCallRecord, Long> {

    long countByCalledAtAfter(LocalDateTime after);
}
