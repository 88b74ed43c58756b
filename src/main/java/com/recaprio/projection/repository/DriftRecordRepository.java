package com.recaprio.projection.repository;

import com.recaprio.projection.domain.DriftRecordEntity;
import com.recaprio.projection.model.DriftReason;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface DriftRecordRepository extends JpaRepository<DriftRecordEntity, Long> {

    Optional<DriftRecordEntity> findFirstByRowKeyAndReasonAndResolvedFalse(Long rowKey, DriftReason reason);

    List<DriftRecordEntity> findByRowKeyAndResolvedFalse(Long rowKey);

    List<DriftRecordEntity> findByResolvedFalseOrderByDetectedAtDesc();

    @Query("select distinct d.rowKey from DriftRecordEntity d where d.resolved = false")
    List<Long> findOpenKeys();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from DriftRecordEntity d where d.resolved = true and d.resolvedAt < :cutoff")
    int purgeResolvedBefore(@Param("cutoff") Instant cutoff);
}
