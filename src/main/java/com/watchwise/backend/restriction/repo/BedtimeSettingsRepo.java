package com.watchwise.backend.restriction.repo;

import com.watchwise.backend.restriction.entity.BedtimeSettings;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface BedtimeSettingsRepo extends JpaRepository<BedtimeSettings, Long> {

    Optional<BedtimeSettings> findByUserId(Long userId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from BedtimeSettings b where b.userId = :userId")
    Optional<BedtimeSettings> findByUserIdForUpdate(@Param("userId") Long userId);

    /** Schedules the bedtime check has to look at: enabled, or still marked active on devices. */
    @Query("select b from BedtimeSettings b where b.enabled = true or b.bedtimeActive = true order by b.id asc")
    List<BedtimeSettings> findEvaluable();
}
