package com.caredirectory.providers.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each refresh cycle for observability. Stored in the refresh_run table.
 */
@Data
@Builder
public class RefreshRun {

    private String runId;           // UUID, also the cycle_id stamped on provider rows
    private RefreshTrigger trigger;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int recordsParsed;
    private int recordsWritten;
    private String errorCode;       // null on success
    private String errorMessage;
}
