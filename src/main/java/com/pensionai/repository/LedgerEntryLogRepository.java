package com.pensionai.repository;

import com.pensionai.entity.AdvisoryRun;
import com.pensionai.entity.LedgerEntryLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

/**
 * Repository interface for managing {@link LedgerEntryLog} entities.
 */
public interface LedgerEntryLogRepository extends JpaRepository<LedgerEntryLog, UUID> {

    List<LedgerEntryLog> findByRunOrderBySequenceAsc(AdvisoryRun run);
}
