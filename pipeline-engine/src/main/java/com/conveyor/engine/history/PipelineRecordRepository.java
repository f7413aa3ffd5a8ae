package com.conveyor.engine.history;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + history queries for the pipeline_records table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface PipelineRecordRepository extends JpaRepository<PipelineRecord, UUID> {

    /** All pipelines of one run, in topological order. */
    List<PipelineRecord> findByRunIdOrderByPositionAsc(UUID runId);

    /** The newest record on a branch; its run is the branch's latest run. */
    Optional<PipelineRecord> findFirstByBranchOrderByRecordedAtDesc(String branch);
}
