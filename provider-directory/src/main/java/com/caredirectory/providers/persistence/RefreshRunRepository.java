package com.caredirectory.providers.persistence;

import com.caredirectory.providers.model.RefreshRun;
import com.caredirectory.providers.model.RefreshTrigger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Refresh run history. Writes are best effort: bookkeeping must never fail a cycle.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class RefreshRunRepository {

    private final JdbcTemplate jdbcTemplate;

    public void save(RefreshRun run) {
        try {
            jdbcTemplate.update("""
                MERGE INTO refresh_run
                (run_id, trigger_source, started_at, completed_at, status,
                 records_parsed, records_written, error_code, error_message)
                KEY (run_id)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """,
                    run.getRunId(),
                    run.getTrigger().name(),
                    Timestamp.valueOf(run.getStartedAt()),
                    run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()) : null,
                    run.getStatus(),
                    run.getRecordsParsed(),
                    run.getRecordsWritten(),
                    run.getErrorCode(),
                    truncate(run.getErrorMessage(), 1024));
        } catch (Exception e) {
            log.warn("Failed to write refresh run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    public Optional<RefreshRun> findLatest() {
        List<RefreshRun> runs = jdbcTemplate.query(
                "SELECT * FROM refresh_run ORDER BY started_at DESC, run_id LIMIT 1",
                (rs, rowNum) -> RefreshRun.builder()
                        .runId(rs.getString("run_id"))
                        .trigger(RefreshTrigger.valueOf(rs.getString("trigger_source")))
                        .startedAt(rs.getTimestamp("started_at").toLocalDateTime())
                        .completedAt(rs.getTimestamp("completed_at") != null
                                ? rs.getTimestamp("completed_at").toLocalDateTime() : null)
                        .status(rs.getString("status"))
                        .recordsParsed(rs.getInt("records_parsed"))
                        .recordsWritten(rs.getInt("records_written"))
                        .errorCode(rs.getString("error_code"))
                        .errorMessage(rs.getString("error_message"))
                        .build());
        return runs.isEmpty() ? Optional.empty() : Optional.of(runs.get(0));
    }

    private String truncate(String val, int max) {
        if (val == null || val.length() <= max) return val;
        return val.substring(0, max);
    }
}
