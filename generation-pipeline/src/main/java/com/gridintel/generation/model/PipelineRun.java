package com.gridintel.generation.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each pipeline invocation for observability.
 * Stored in the pipeline_runs table when the ClickHouse mirror is enabled.
 */
@Data
@Builder
public class PipelineRun {

    public static final String RUNNING = "RUNNING";
    public static final String SUCCESS = "SUCCESS";
    public static final String FAILED = "FAILED";
    public static final String SKIPPED = "SKIPPED";

    private String runId;                   // UUID
    private LocalDateTime effectiveTimestamp;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;
    private int unitsFetched;
    private int rowsWritten;
    private int addedUnits;
    private int missingUnits;
    private String errorMessage;            // null on success
}
