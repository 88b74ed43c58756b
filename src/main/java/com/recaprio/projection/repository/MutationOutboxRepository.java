package com.recaprio.projection.repository;

import com.recaprio.projection.domain.MutationOutboxEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface MutationOutboxRepository extends JpaRepository<MutationOutboxEntry, Long> {

    int countByStatus(MutationOutboxEntry.Status status);

    List<MutationOutboxEntry> findByStatusAndLastAttemptBeforeOrderByIdAsc(MutationOutboxEntry.Status status, Instant before,
                                                                        Pageable pageable);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("delete from MutationOutboxEntry e where e.status in :statuses and e.lastAttempt < :cutoff")
    int purgeByStatusBefore(@Param("statuses") List<MutationOutboxEntry.Status> statuses, @Param("cutoff") Instant cutoff);
}
