package com.watchwise.backend.restriction.repo;

import com.watchwise.backend.restriction.entity.AppRestriction;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface AppRestrictionRepo extends JpaRepository<AppRestriction, Long> {

    Optional<AppRestriction> findByParentIdAndBundleId(Long parentId, String bundleId);

    boolean existsByParentIdAndBundleId(Long parentId, String bundleId);

    List<AppRestriction> findByParentIdOrderByBundleIdAsc(Long parentId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select r from AppRestriction r where r.parentId = :parentId and r.bundleId = :bundleId")
    Optional<AppRestriction> findForUpdate(@Param("parentId") Long parentId, @Param("bundleId") String bundleId);
}
