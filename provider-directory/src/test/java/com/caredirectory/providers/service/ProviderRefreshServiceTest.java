package com.caredirectory.providers.service;

import com.caredirectory.providers.config.ProviderDirectoryProperties;
import com.caredirectory.providers.exception.EmptyDatasetException;
import com.caredirectory.providers.exception.FeedFetchException;
import com.caredirectory.providers.exception.ProviderPersistenceException;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.net.URI;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ProviderRefreshServiceTest {

    private static final LocalDate RUN_DATE = LocalDate.of(2026, 3, 2);
    private static final byte[] RAW = "raw".getBytes();

    private final PublishedSnapshot february =
            new PublishedSnapshot(Path.of("snapshots/providers-2026-2-2.zip"), "2026-2-2");
    private final PublishedSnapshot march =
            new PublishedSnapshot(Path.of("snapshots/providers-2026-3-2.zip"), "2026-3-2");
    private final StagedSnapshot stagedMarch =
            new StagedSnapshot(Path.of("snapshots/providers-123.zip.tmp"), march.path(), "2026-3-2");

    private ProviderFeedFetcher fetcher;
    private HealthcareCsvParser parser;
    private CategorySeeder seeder;
    private ProviderBatchWriter writer;
    private UpdateLedger ledger;
    private SnapshotBuilder snapshotBuilder;
    private RefreshRunRepository runRepository;
    private PublicationGate gate;
    private ProviderRefreshService service;

    @BeforeEach
    void setUp() {
        fetcher = mock(ProviderFeedFetcher.class);
        parser = mock(HealthcareCsvParser.class);
        seeder = mock(CategorySeeder.class);
        writer = mock(ProviderBatchWriter.class);
        ledger = mock(UpdateLedger.class);
        snapshotBuilder = mock(SnapshotBuilder.class);
        runRepository = mock(RefreshRunRepository.class);
        gate = new PublicationGate();

        ProviderDirectoryProperties properties = new ProviderDirectoryProperties();
        properties.getFeed().setUrl("http://feed.test/providers.csv");
        Clock clock = Clock.fixed(Instant.parse("2026-03-02T01:00:00Z"), ZoneId.of("Europe/Prague"));

        service = new ProviderRefreshService(fetcher, parser, seeder, writer, ledger, snapshotBuilder,
                gate, runRepository, properties, clock);

        gate.publish(february);
        when(fetcher.fetch(URI.create("http://feed.test/providers.csv"))).thenReturn(RAW);
        when(parser.parse(RAW)).thenReturn(providers(3));
        when(writer.write(anyList(), anyString())).thenReturn(3);
        when(snapshotBuilder.build("2026-3-2")).thenReturn(stagedMarch);
        when(snapshotBuilder.promote(stagedMarch)).thenReturn(march);
        when(ledger.lastUpdate()).thenReturn(Optional.of(LocalDate.of(2026, 2, 2)));
        when(ledger.recordSuccessfulUpdate(RUN_DATE)).thenReturn("2026-3-2");
    }

    @Test
    void successfulCycleRunsStagesInOrderAndSwapsSnapshot() {
        UpdateStatusMessage result = service.runUpdate();

        assertEquals(ProviderRefreshService.SUCCESS_MESSAGE, result.message());
        InOrder order = inOrder(fetcher, parser, seeder, writer, snapshotBuilder, ledger);
        order.verify(fetcher).fetch(any());
        order.verify(parser).parse(RAW);
        order.verify(seeder).seed();
        order.verify(writer).write(anyList(), anyString());
        order.verify(writer).purgeOtherCycles(anyString());
        order.verify(snapshotBuilder).build("2026-3-2");
        order.verify(ledger).recordSuccessfulUpdate(RUN_DATE);
        order.verify(snapshotBuilder).promote(stagedMarch);
        order.verify(snapshotBuilder).retire(february, march);

        assertEquals(march.path(), gate.currentSnapshotPath());
        assertFalse(gate.isUpdating());

        RefreshRun run = lastSavedRun();
        assertEquals("SUCCESS", run.getStatus());
        assertEquals(RefreshTrigger.ON_DEMAND, run.getTrigger());
        assertEquals(3, run.getRecordsParsed());
        assertEquals(3, run.getRecordsWritten());
    }

    @Test
    void cycleWritesProvidersUnderItsRunId() {
        service.runUpdate();

        ArgumentCaptor<String> cycleId = ArgumentCaptor.forClass(String.class);
        verify(writer).write(anyList(), cycleId.capture());
        verify(writer).purgeOtherCycles(cycleId.getValue());
        assertEquals(lastSavedRun().getRunId(), cycleId.getValue());
    }

    @Test
    void emptyFeedFailsWithoutTouchingStorageLedgerOrSnapshot() {
        when(parser.parse(RAW)).thenReturn(List.of());

        assertThrows(EmptyDatasetException.class, () -> service.runUpdate());

        verify(seeder, never()).seed();
        verify(writer, never()).write(anyList(), anyString());
        verify(ledger, never()).recordSuccessfulUpdate(any());
        verify(snapshotBuilder, never()).build(anyString());
        assertEquals(february.path(), gate.currentSnapshotPath());
        assertFalse(gate.isUpdating());
        assertEquals("EMPTY_DATASET", lastSavedRun().getErrorCode());
        assertEquals("FAILED", lastSavedRun().getStatus());
    }

    @Test
    void fetchFailureResetsUpdatingFlag() {
        when(fetcher.fetch(any())).thenThrow(new FeedFetchException("Open data feed returned HTTP 500"));

        assertThrows(FeedFetchException.class, () -> service.runUpdate());

        assertFalse(gate.isUpdating());
        assertEquals(february.path(), gate.currentSnapshotPath());
        assertEquals("FEED_FETCH_FAILED", lastSavedRun().getErrorCode());
    }

    @Test
    void persistenceFailureAbortsBeforeSnapshot() {
        when(writer.write(anyList(), anyString()))
                .thenThrow(new ProviderPersistenceException("Provider batch 1 could not be saved", null));

        assertThrows(ProviderPersistenceException.class, () -> service.runUpdate());

        verify(writer, never()).purgeOtherCycles(anyString());
        verify(snapshotBuilder, never()).build(anyString());
        verify(ledger, never()).recordSuccessfulUpdate(any());
        assertEquals(february.path(), gate.currentSnapshotPath());
    }

    @Test
    void snapshotFailureKeepsPreviousSnapshotAndLedger() {
        when(snapshotBuilder.build("2026-3-2"))
                .thenThrow(new SnapshotWriteException("The file cannot be created.", null));

        assertThrows(SnapshotWriteException.class, () -> service.runUpdate());

        verify(ledger, never()).recordSuccessfulUpdate(any());
        verify(snapshotBuilder, never()).retire(any(), any());
        assertEquals(february.path(), gate.currentSnapshotPath());
        assertFalse(gate.isUpdating());
    }

    @Test
    void ledgerFailureDiscardsStagedSnapshot() {
        when(ledger.recordSuccessfulUpdate(RUN_DATE))
                .thenThrow(new ProviderPersistenceException("Last update date could not be saved", null));

        assertThrows(ProviderPersistenceException.class, () -> service.runUpdate());

        verify(snapshotBuilder).discard(stagedMarch);
        verify(snapshotBuilder, never()).promote(any());
        assertEquals(february.path(), gate.currentSnapshotPath());
    }

    @Test
    void failedPromotionRestoresPreviousLedgerDate() {
        when(snapshotBuilder.promote(stagedMarch))
                .thenThrow(new SnapshotWriteException("The file cannot be created.", null));

        assertThrows(SnapshotWriteException.class, () -> service.runUpdate());

        verify(ledger).restore(Optional.of(LocalDate.of(2026, 2, 2)));
        verify(snapshotBuilder, never()).retire(any(), any());
        assertEquals(february.path(), gate.currentSnapshotPath());
        assertFalse(gate.isUpdating());
    }

    @Test
    void failedLedgerRestoreIsAttachedToSnapshotFailure() {
        SnapshotWriteException moveFailure = new SnapshotWriteException("The file cannot be created.", null);
        when(snapshotBuilder.promote(stagedMarch)).thenThrow(moveFailure);
        ProviderPersistenceException restoreFailure =
                new ProviderPersistenceException("Last update date could not be restored", null);
        doThrow(restoreFailure).when(ledger).restore(any());

        SnapshotWriteException thrown = assertThrows(SnapshotWriteException.class, () -> service.runUpdate());

        assertSame(moveFailure, thrown);
        assertArrayEquals(new Throwable[]{restoreFailure}, thrown.getSuppressed());
    }

    @Test
    void concurrentTriggerIsRejectedWhileCycleRuns() throws Exception {
        CountDownLatch fetchStarted = new CountDownLatch(1);
        CountDownLatch releaseFetch = new CountDownLatch(1);
        when(fetcher.fetch(any())).thenAnswer(invocation -> {
            fetchStarted.countDown();
            assertTrue(releaseFetch.await(5, TimeUnit.SECONDS));
            return RAW;
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<UpdateStatusMessage> first = executor.submit(() -> service.runUpdate(RefreshTrigger.SCHEDULED));
            assertTrue(fetchStarted.await(5, TimeUnit.SECONDS));

            assertTrue(gate.isUpdating());
            assertThrows(UpdateInProgressException.class, () -> service.runUpdate());
            assertThrows(UpdateInProgressException.class, gate::currentSnapshotPath);

            releaseFetch.countDown();
            assertEquals(ProviderRefreshService.SUCCESS_MESSAGE, first.get(5, TimeUnit.SECONDS).message());
        } finally {
            executor.shutdownNow();
        }

        verify(fetcher, times(1)).fetch(any());
        assertFalse(gate.isUpdating());
        assertEquals(march.path(), gate.currentSnapshotPath());
    }

    private RefreshRun lastSavedRun() {
        ArgumentCaptor<RefreshRun> runs = ArgumentCaptor.forClass(RefreshRun.class);
        verify(runRepository, times(2)).save(runs.capture());
        return runs.getValue();
    }

    private List<HealthcareProvider> providers(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> HealthcareProvider.builder()
                        .locationId((long) i)
                        .institutionId(0L)
                        .title("Ordinace " + i)
                        .category(List.of())
                        .build())
                .toList();
    }
}
