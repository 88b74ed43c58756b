package com.recaprio.projection.repository;

import com.recaprio.projection.domain.ProjectionRowEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.NoRepositoryBean;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

/**
 * Queries shared by the projection tables kept apart from the base relation.
 */
@NoRepositoryBean
public interface ProjectionRowRepository<E extends ProjectionRowEntity> extends JpaRepository<E, Long> {

    List<E> findByRowKeyBetweenAndDeletedFalseOrderByRowKeyAsc(Long from, Long to, Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from #{#entityName} p where p.deleted = true and p.deletedAt < :cutoff")
    int purgeDeletedBefore(@Param("cutoff") Instant cutoff);
}
