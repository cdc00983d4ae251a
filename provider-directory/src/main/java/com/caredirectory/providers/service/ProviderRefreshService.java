package com.caredirectory.providers.service;

import com.caredirectory.providers.config.ProviderDirectoryProperties;
import com.caredirectory.providers.exception.EmptyDatasetException;
import com.caredirectory.providers.exception.ProviderDirectoryException;
import com.caredirectory.providers.exception.SnapshotWriteException;
import com.caredirectory.providers.exception.UpdateInProgressException;
import com.caredirectory.providers.model.HealthcareProvider;
import com.caredirectory.providers.model.PublishedSnapshot;
import com.caredirectory.providers.model.RefreshRun;
import com.caredirectory.providers.model.RefreshTrigger;
import com.caredirectory.providers.model.StagedSnapshot;
import com.caredirectory.providers.model.UpdateStatusMessage;
import com.caredirectory.providers.persistence.CategorySeeder;
import com.caredirectory.providers.persistence.ProviderBatchWriter;
import com.caredirectory.providers.persistence.RefreshRunRepository;
import com.caredirectory.providers.persistence.UpdateLedger;
import com.caredirectory.providers.snapshot.PublicationGate;
import com.caredirectory.providers.snapshot.SnapshotBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates one refresh cycle: fetch, parse, seed categories, write providers in batches,
 * purge providers missing from the feed, build the snapshot, record the update date and publish.
 *
 * At most one cycle runs at a time. The lock is held for the whole cycle and taken with
 * tryLock, so a trigger arriving mid-cycle fails fast instead of queueing.
 *
 * The archive is staged first, the update date recorded next, and only then is the archive moved
 * onto its final name and published. A failure at any of these steps leaves both the ledger and
 * the served archive at the previous cycle.
 */
@Service
@Slf4j
public class ProviderRefreshService {

    public static final String SUCCESS_MESSAGE = "Data successfully updated.";

    private final ProviderFeedFetcher feedFetcher;
    private final HealthcareCsvParser parser;
    private final CategorySeeder categorySeeder;
    private final ProviderBatchWriter batchWriter;
    private final UpdateLedger updateLedger;
    private final SnapshotBuilder snapshotBuilder;
    private final PublicationGate publicationGate;
    private final RefreshRunRepository refreshRunRepository;
    private final ProviderDirectoryProperties properties;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    public ProviderRefreshService(ProviderFeedFetcher feedFetcher,
                                  HealthcareCsvParser parser,
                                  CategorySeeder categorySeeder,
                                  ProviderBatchWriter batchWriter,
                                  UpdateLedger updateLedger,
                                  SnapshotBuilder snapshotBuilder,
                                  PublicationGate publicationGate,
                                  RefreshRunRepository refreshRunRepository,
                                  ProviderDirectoryProperties properties,
                                  Clock clock) {
        this.feedFetcher = feedFetcher;
        this.parser = parser;
        this.categorySeeder = categorySeeder;
        this.batchWriter = batchWriter;
        this.updateLedger = updateLedger;
        this.snapshotBuilder = snapshotBuilder;
        this.publicationGate = publicationGate;
        this.refreshRunRepository = refreshRunRepository;
        this.properties = properties;
        this.clock = clock;
    }

    public UpdateStatusMessage runUpdate() {
        return runUpdate(RefreshTrigger.ON_DEMAND);
    }

    /**
     * Runs one full cycle on the calling thread.
     *
     * @throws UpdateInProgressException if another cycle is running
     * @throws ProviderDirectoryException subtype describing the failed stage
     */
    public UpdateStatusMessage runUpdate(RefreshTrigger trigger) {
        if (!cycleLock.tryLock()) {
            log.warn("{} refresh rejected: a refresh is already running", trigger);
            throw new UpdateInProgressException();
        }
        try {
            publicationGate.beginUpdate();
            RefreshRun run = RefreshRun.builder()
                    .runId(UUID.randomUUID().toString())
                    .trigger(trigger)
                    .startedAt(LocalDateTime.now(clock))
                    .status("RUNNING")
                    .build();
            refreshRunRepository.save(run);
            log.info("Refresh {} started ({})", run.getRunId(), trigger);

            try {
                runCycle(run);
                run.setStatus("SUCCESS");
            } catch (RuntimeException e) {
                run.setStatus("FAILED");
                run.setErrorCode(e instanceof ProviderDirectoryException pde ? pde.getErrorCode() : "INTERNAL_ERROR");
                run.setErrorMessage(e.getMessage());
                throw e;
            } finally {
                publicationGate.endUpdate();
                run.setCompletedAt(LocalDateTime.now(clock));
                refreshRunRepository.save(run);
                log.info("Refresh {} finished: {}", run.getRunId(), run.getStatus());
            }
        } finally {
            cycleLock.unlock();
        }
        return new UpdateStatusMessage(SUCCESS_MESSAGE);
    }

    /**
     * Re-publishes the archive of the last recorded update if it is still on disk. Used at startup.
     */
    public Optional<PublishedSnapshot> restorePublishedSnapshot() {
        cycleLock.lock();
        try {
            Optional<LocalDate> lastUpdate = updateLedger.lastUpdate();
            if (lastUpdate.isEmpty()) {
                log.info("No previous update recorded, nothing to publish yet");
                return Optional.empty();
            }
            String label = UpdateLedger.labelFor(lastUpdate.get());
            Path path = snapshotBuilder.pathFor(label);
            if (!Files.isRegularFile(path)) {
                log.warn("Snapshot {} for last update {} is missing; waiting for next refresh", path, label);
                return Optional.empty();
            }
            PublishedSnapshot snapshot = new PublishedSnapshot(path, label);
            publicationGate.publish(snapshot);
            log.info("Restored published snapshot {}", path.getFileName());
            return Optional.of(snapshot);
        } finally {
            cycleLock.unlock();
        }
    }

    public boolean isUpdating() {
        return publicationGate.isUpdating();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void runCycle(RefreshRun run) {
        byte[] raw = feedFetcher.fetch(URI.create(properties.getFeed().getUrl()));

        List<HealthcareProvider> providers = parser.parse(raw);
        run.setRecordsParsed(providers.size());
        if (providers.isEmpty()) {
            throw new EmptyDatasetException();
        }

        categorySeeder.seed();
        run.setRecordsWritten(batchWriter.write(providers, run.getRunId()));
        batchWriter.purgeOtherCycles(run.getRunId());

        LocalDate updateDate = LocalDate.now(clock);
        Optional<LocalDate> previousUpdate = updateLedger.lastUpdate();
        StagedSnapshot staged = snapshotBuilder.build(UpdateLedger.labelFor(updateDate));
        try {
            updateLedger.recordSuccessfulUpdate(updateDate);
        } catch (RuntimeException e) {
            snapshotBuilder.discard(staged);
            throw e;
        }

        PublishedSnapshot snapshot = promoteOrRestoreLedger(staged, previousUpdate);
        publicationGate.publish(snapshot)
                .ifPresent(previous -> snapshotBuilder.retire(previous, snapshot));
        log.info("Published snapshot {} ({} providers)", snapshot.path().getFileName(), providers.size());
    }

    /** The update date is already recorded here, so a failed move puts the ledger back. */
    private PublishedSnapshot promoteOrRestoreLedger(StagedSnapshot staged, Optional<LocalDate> previousUpdate) {
        try {
            return snapshotBuilder.promote(staged);
        } catch (SnapshotWriteException e) {
            try {
                updateLedger.restore(previousUpdate);
            } catch (RuntimeException restoreFailure) {
                e.addSuppressed(restoreFailure);
            }
            throw e;
        }
    }
}
