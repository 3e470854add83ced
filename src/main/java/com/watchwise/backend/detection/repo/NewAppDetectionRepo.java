package com.watchwise.backend.detection.repo;

import com.watchwise.backend.detection.entity.NewAppDetection;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface NewAppDetectionRepo extends JpaRepository<NewAppDetection, Long> {

    boolean existsByParentIdAndBundleId(Long parentId, String bundleId);

    List<NewAppDetection> findByParentIdAndProcessedFalseOrderByDetectedAtDesc(Long parentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select d from NewAppDetection d where d.id = :id")
    Optional<NewAppDetection> findByIdForUpdate(@Param("id") Long id);
}
