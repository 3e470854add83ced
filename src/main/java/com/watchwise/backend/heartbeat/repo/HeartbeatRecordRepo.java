package com.watchwise.backend.heartbeat.repo;

import com.watchwise.backend.heartbeat.entity.HeartbeatRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface HeartbeatRecordRepo extends JpaRepository<HeartbeatRecord, Long> {

    Optional<HeartbeatRecord> findByChildUserId(Long childUserId);
}
