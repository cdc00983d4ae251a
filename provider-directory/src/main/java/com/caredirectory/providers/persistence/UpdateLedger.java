package com.caredirectory.providers.persistence;

import com.caredirectory.providers.exception.ProviderPersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Single-row record of the last successful update, kept in server_properties.
 *
 * Zero rows means the directory was never updated. The row is created by the first successful
 * cycle and updated in place afterwards.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class UpdateLedger {

    public static final String NOT_INITIALIZED = "not initialized";

    private static final int LEDGER_ROW_ID = 1;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;

    /**
     * Label used in snapshot file names and status responses, e.g. {@code 2026-3-2}.
     */
    public static String labelFor(LocalDate date) {
        return date.getYear() + "-" + date.getMonthValue() + "-" + date.getDayOfMonth();
    }

    /**
     * Reads or creates the ledger row and sets it to {@code date}, all in one transaction.
     *
     * @return the new update label
     */
    public String recordSuccessfulUpdate(LocalDate date) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                List<Integer> rows = jdbcTemplate.queryForList(
                        "SELECT id FROM server_properties FOR UPDATE", Integer.class);
                if (rows.isEmpty()) {
                    jdbcTemplate.update("INSERT INTO server_properties (id, last_update) VALUES (?, ?)",
                            LEDGER_ROW_ID, date);
                } else {
                    jdbcTemplate.update("UPDATE server_properties SET last_update = ? WHERE id = ?",
                            date, rows.get(0));
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new ProviderPersistenceException("Last update date could not be saved", e);
        }
        String label = labelFor(date);
        log.info("Recorded successful update: {}", label);
        return label;
    }

    /**
     * Puts the ledger back to {@code previous}, removing the row if there was none. Used when a
     * cycle fails after its update date was already recorded.
     */
    public void restore(Optional<LocalDate> previous) {
        try {
            transactionTemplate.executeWithoutResult(status -> {
                if (previous.isPresent()) {
                    jdbcTemplate.update("UPDATE server_properties SET last_update = ?", previous.get());
                } else {
                    jdbcTemplate.update("DELETE FROM server_properties");
                }
            });
        } catch (DataAccessException | TransactionException e) {
            throw new ProviderPersistenceException("Last update date could not be restored", e);
        }
        log.warn("Ledger restored to {}", previous.map(UpdateLedger::labelFor).orElse(NOT_INITIALIZED));
    }

    public Optional<LocalDate> lastUpdate() {
        List<LocalDate> dates = jdbcTemplate.queryForList(
                "SELECT last_update FROM server_properties ORDER BY id", LocalDate.class);
        return dates.isEmpty() ? Optional.empty() : Optional.of(dates.get(0));
    }

    public String currentUpdateLabel() {
        return lastUpdate().map(UpdateLedger::labelFor).orElse(NOT_INITIALIZED);
    }
}
