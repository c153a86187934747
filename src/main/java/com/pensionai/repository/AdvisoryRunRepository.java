package com.pensionai.repository;

import com.pensionai.entity.AdvisoryRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for managing {@link AdvisoryRun} entities.
 */
public interface AdvisoryRunRepository extends JpaRepository<AdvisoryRun, UUID> {

    Optional<AdvisoryRun> findByRunId(String runId);
}
