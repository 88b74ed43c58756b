package com.recaprio.projection.repository;

import com.recaprio.projection.domain.BaseRowEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BaseRowRepository extends JpaRepository<BaseRowEntity, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from BaseRowEntity b where b.rowKey = :key")
    Optional<BaseRowEntity> findForUpdate(@Param("key") Long key);

    List<BaseRowEntity> findByRowKeyBetweenOrderByRowKeyAsc(Long from, Long to, Pageable pageable);

    List<BaseRowEntity> findByRowKeyBetweenAndDerivedVersionNotNullOrderByRowKeyAsc(Long from, Long to, Pageable pageable);

    @Query("select b.rowKey from BaseRowEntity b where b.rowKey in :keys")
    List<Long> findExistingKeys(@Param("keys") Collection<Long> keys);
}
