package com.conveyor.engine.history;

import com.conveyor.engine.model.EventType;
import com.conveyor.engine.model.PipelineState;
import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Final outcome of one pipeline in one run.
 *
 * DB table: pipeline_records  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "pipeline_records")
public class PipelineRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "run_id", nullable = false)
    private UUID runId;

    // Topological position within the run, so a run reads back in order.
    @Column(name = "seq_no", nullable = false)
    private int position;

    @Column(name = "pipeline_name", nullable = false)
    private String pipelineName;

    @Column(name = "template_name", nullable = false)
    private String templateName;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EventType eventType;

    @Column(name = "git_ref")
    private String ref;

    private String branch;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private PipelineState state;

    @Column(length = 2000)
    private String reason;

    @Column(name = "blocked_by")
    private String blockedBy;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "finished_at")
    private Instant finishedAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt = Instant.now();

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected PipelineRecord() {}   // required by JPA

    public PipelineRecord(UUID runId, int position, String pipelineName, String templateName,
                          EventType eventType, String ref, String branch, PipelineState state) {
        this.runId        = runId;
        this.position     = position;
        this.pipelineName = pipelineName;
        this.templateName = templateName;
        this.eventType    = eventType;
        this.ref          = ref;
        this.branch       = branch;
        this.state        = state;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()           { return id; }
    public UUID          getRunId()        { return runId; }
    public int           getPosition()     { return position; }
    public String        getPipelineName() { return pipelineName; }
    public String        getTemplateName() { return templateName; }
    public EventType     getEventType()    { return eventType; }
    public String        getRef()          { return ref; }
    public String        getBranch()       { return branch; }
    public PipelineState getState()        { return state; }
    public String        getReason()       { return reason; }
    public String        getBlockedBy()    { return blockedBy; }
    public Instant       getStartedAt()    { return startedAt; }
    public Instant       getFinishedAt()   { return finishedAt; }
    public Instant       getRecordedAt()   { return recordedAt; }

    public void setReason(String reason)        { this.reason = reason; }
    public void setBlockedBy(String blockedBy)  { this.blockedBy = blockedBy; }
    public void setStartedAt(Instant t)         { this.startedAt = t; }
    public void setFinishedAt(Instant t)        { this.finishedAt = t; }
    public void setRecordedAt(Instant t)        { this.recordedAt = t; }
}
