package com.conveyor.engine.history;

import com.conveyor.engine.model.BuildStatus;
import com.conveyor.engine.model.Event;
import com.conveyor.engine.model.PipelineState;
import com.conveyor.engine.scheduler.PipelineOutcome;
import com.conveyor.engine.scheduler.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Build history in the relational database, one row per pipeline outcome.
 */
@Component
public class JpaBuildHistoryStore implements BuildHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(JpaBuildHistoryStore.class);

    private final PipelineRecordRepository records;

    public JpaBuildHistoryStore(PipelineRecordRepository records) {
        this.records = records;
    }

    /**
     * All rows of a run share one recordedAt so "latest run on a branch"
     * never mixes two runs.
     */
    @Override
    @Transactional
    public void record(RunReport report) {
        Event event = report.event();
        Instant recordedAt = report.finishedAt() == null ? Instant.now() : report.finishedAt();
        List<PipelineRecord> rows = new ArrayList<>(report.pipelines().size());
        int position = 0;
        for (PipelineOutcome outcome : report.pipelines()) {
            PipelineRecord row = new PipelineRecord(report.runId(), position++, outcome.name(),
                    outcome.templateName(), event.type(), event.ref(), event.branch(), outcome.state());
            row.setReason(truncate(outcome.reason()));
            row.setBlockedBy(outcome.blockedBy());
            row.setStartedAt(outcome.startedAt());
            row.setFinishedAt(outcome.finishedAt());
            row.setRecordedAt(recordedAt);
            rows.add(row);
        }
        records.saveAll(rows);
        log.info("Recorded {} pipeline outcome(s) of run {} ({})",
                rows.size(), report.runId(), report.status());
    }

    @Override
    @Transactional(readOnly = true)
    public List<PipelineOutcome> findRun(UUID runId) {
        return records.findByRunIdOrderByPositionAsc(runId).stream()
                .map(r -> new PipelineOutcome(r.getPipelineName(), r.getTemplateName(), r.getState(),
                        r.getReason(), r.getBlockedBy(), List.of(), r.getStartedAt(), r.getFinishedAt()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BuildStatus> latestStatus(String branch) {
        if (branch == null || branch.isBlank()) return Optional.empty();
        return records.findFirstByBranchOrderByRecordedAtDesc(branch)
                .map(latest -> records.findByRunIdOrderByPositionAsc(latest.getRunId()).stream()
                        .anyMatch(r -> r.getState() == PipelineState.FAILED)
                        ? BuildStatus.FAILURE
                        : BuildStatus.SUCCESS);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static String truncate(String reason) {
        if (reason == null || reason.length() <= 2000) return reason;
        return reason.substring(0, 1997) + "...";
    }
}
