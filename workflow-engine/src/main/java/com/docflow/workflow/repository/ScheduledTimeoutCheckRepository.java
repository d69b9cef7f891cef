package com.docflow.workflow.repository;

import com.docflow.workflow.model.ScheduledTimeoutCheck;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Queue of deferred timeout checks. The table is the queue; claiming a
 * row is a locked SELECT followed by stamping fired_at in the same
 * transaction.
 */
public interface ScheduledTimeoutCheckRepository extends JpaRepository<ScheduledTimeoutCheck, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            SELECT c FROM ScheduledTimeoutCheck c
            WHERE c.firedAt IS NULL AND c.dueAt <= :now
            ORDER BY c.dueAt ASC
            """)
    List<ScheduledTimeoutCheck> claimDue(@Param("now") Instant now, Pageable page);
}
