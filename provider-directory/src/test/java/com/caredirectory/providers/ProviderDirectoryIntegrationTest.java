package com.caredirectory.providers;

import com.caredirectory.providers.exception.EmptyDatasetException;
import com.caredirectory.providers.exception.ProviderNotFoundException;
import com.caredirectory.providers.exception.ProviderPersistenceException;
import com.caredirectory.providers.exception.SnapshotNotAvailableException;
import com.caredirectory.providers.model.HealthcareCategory;
import com.caredirectory.providers.model.HealthcareProviderDetail;
import com.caredirectory.providers.model.HealthcareProviderId;
import com.caredirectory.providers.model.HealthcareProviderIdList;
import com.caredirectory.providers.model.PublishedSnapshot;
import com.caredirectory.providers.model.RefreshRun;
import com.caredirectory.providers.model.UpdateStatus;
import com.caredirectory.providers.persistence.RefreshRunRepository;
import com.caredirectory.providers.persistence.UpdateLedger;
import com.caredirectory.providers.service.ProviderQueryService;
import com.caredirectory.providers.service.ProviderRefreshService;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestProviderDirectoryConfig.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class ProviderDirectoryIntegrationTest {

    @Autowired
    private ProviderRefreshService refreshService;

    @Autowired
    private ProviderQueryService queryService;

    @Autowired
    private RefreshRunRepository refreshRunRepository;

    @Autowired
    private TestProviderDirectoryConfig.QueuedFeedFetcher feedFetcher;

    @Autowired
    private TestProviderDirectoryConfig.MutableClock clock;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @SpyBean
    private UpdateLedger updateLedger;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void refreshPublishesEveryProviderFromTheFeed() throws IOException {
        feedFetcher.enqueue(ProviderFeedFixtures.csv(1200));

        assertEquals(ProviderRefreshService.SUCCESS_MESSAGE, refreshService.runUpdate().message());

        Path snapshot = queryService.currentSnapshotPath();
        assertEquals("providers-2026-3-2.zip", snapshot.getFileName().toString());
        assertTrue(Files.isRegularFile(snapshot));
        List<Map<String, Object>> entries = readSnapshot(snapshot);
        assertEquals(1200, entries.size());
        assertEquals(1200, entries.stream().map(e -> e.get("locationId")).distinct().count());

        assertEquals(new UpdateStatus("2026-3-2", false), queryService.getStatus());
        assertEquals(1200, countRows("healthcare_provider"));
        assertEquals(HealthcareCategory.values().length, countRows("healthcare_category"));

        RefreshRun run = refreshRunRepository.findLatest().orElseThrow();
        assertEquals("SUCCESS", run.getStatus());
        assertEquals(1200, run.getRecordsParsed());
        assertEquals(1200, run.getRecordsWritten());
    }

    @Test
    void secondRefreshReplacesSnapshotAndLedgerRow() throws IOException {
        feedFetcher.enqueue(ProviderFeedFixtures.csv(700));
        refreshService.runUpdate();
        Path march = queryService.currentSnapshotPath();
        List<Map<String, Object>> marchEntries = readSnapshot(march);

        clock.setDate(LocalDate.of(2026, 4, 2));
        feedFetcher.enqueue(ProviderFeedFixtures.csv(700));
        refreshService.runUpdate();

        Path april = queryService.currentSnapshotPath();
        assertEquals("providers-2026-4-2.zip", april.getFileName().toString());
        assertFalse(Files.exists(march));
        assertEquals(List.of(april), snapshotFiles(april.getParent()));
        assertEquals(marchEntries, readSnapshot(april));

        assertEquals(1, countRows("server_properties"));
        assertEquals("2026-4-2", queryService.getStatus().lastUpdate());
    }

    @Test
    void providersMissingFromLatestFeedAreRemoved() {
        feedFetcher.enqueue(ProviderFeedFixtures.csv(600));
        refreshService.runUpdate();

        feedFetcher.enqueue(ProviderFeedFixtures.csv(550));
        refreshService.runUpdate();

        assertEquals(550, countRows("healthcare_provider"));
        assertThrows(ProviderNotFoundException.class,
                () -> queryService.getDetail(new HealthcareProviderId(1000L + 575, 0L)));
        assertEquals(0, jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM healthcare_provider_category WHERE location_id = ?", Integer.class, 1575L));
    }

    @Test
    void emptyFeedKeepsLedgerAndPublishedSnapshot() {
        feedFetcher.enqueue(ProviderFeedFixtures.csv(10));
        refreshService.runUpdate();
        Path published = queryService.currentSnapshotPath();

        clock.setDate(LocalDate.of(2026, 4, 2));
        feedFetcher.enqueue(ProviderFeedFixtures.headerOnly());
        assertThrows(EmptyDatasetException.class, () -> refreshService.runUpdate());

        assertEquals(new UpdateStatus("2026-3-2", false), queryService.getStatus());
        assertEquals(published, queryService.currentSnapshotPath());
        assertTrue(Files.isRegularFile(published));
        assertEquals("FAILED", refreshRunRepository.findLatest().orElseThrow().getStatus());
    }

    @Test
    void sameDayRerunWithFailedLedgerKeepsServedArchiveUnchanged() throws IOException {
        feedFetcher.enqueue(ProviderFeedFixtures.csv(3));
        refreshService.runUpdate();
        Path published = queryService.currentSnapshotPath();
        byte[] publishedContent = Files.readAllBytes(published);

        doThrow(new ProviderPersistenceException("Last update date could not be saved", null))
                .when(updateLedger).recordSuccessfulUpdate(any());
        feedFetcher.enqueue(ProviderFeedFixtures.csv(9));
        assertThrows(ProviderPersistenceException.class, () -> refreshService.runUpdate());

        assertEquals(published, queryService.currentSnapshotPath());
        assertArrayEquals(publishedContent, Files.readAllBytes(published));
        assertEquals(3, readSnapshot(published).size());
        assertEquals(List.of(published), allFiles(published.getParent()));
    }

    @Test
    void failedBatchLeavesEarlierBatchesCommittedAndNothingPublished() {
        String rows = new String(ProviderFeedFixtures.csv(1200), StandardCharsets.UTF_8);
        String oversizedTitle = "\"" + "X".repeat(600) + "\"";
        rows = rows.replace("\"Ordinace 700\"", oversizedTitle);
        feedFetcher.enqueue(rows.getBytes(StandardCharsets.UTF_8));

        assertThrows(ProviderPersistenceException.class, () -> refreshService.runUpdate());

        assertEquals(500, countRows("healthcare_provider"));
        assertEquals(HealthcareCategory.values().length, countRows("healthcare_category"));
        assertFalse(queryService.getStatus().updating());
        assertThrows(SnapshotNotAvailableException.class, () -> queryService.currentSnapshotPath());
        assertEquals(0, countRows("server_properties"));
    }

    @Test
    void detailLookupReturnsStoredFields() {
        feedFetcher.enqueue(ProviderFeedFixtures.csv(3));
        refreshService.runUpdate();

        HealthcareProviderDetail detail = queryService.getDetail(new HealthcareProviderId(1001L, 0L));

        assertEquals("Ordinace 1", detail.title());
        assertEquals("Samostatná ordinace lékaře", detail.institutionType());
        assertEquals("Vodičkova", detail.street());
        assertEquals("ordinace1@example.cz", detail.email());
        assertEquals("www.ordinace1.cz", detail.website());
        assertEquals("ambulantní péče", detail.careForm());
        assertEquals("MUDr. Jan Novák", detail.substitute());
        assertEquals(List.of(HealthcareCategory.GENERAL_PRACTITIONER.getValue(),
                HealthcareCategory.CARDIOLOGY.getValue()), detail.category());
        assertEquals(50.081, detail.lat(), 1e-9);
        assertEquals(14.421, detail.lng(), 1e-9);
    }

    @Test
    void multipleLookupKeepsOrderAndFailsAsAWhole() {
        feedFetcher.enqueue(ProviderFeedFixtures.csv(3));
        refreshService.runUpdate();

        List<HealthcareProviderDetail> details = queryService.getDetails(new HealthcareProviderIdList(List.of(
                new HealthcareProviderId(1002L, 0L), new HealthcareProviderId(1000L, 0L))))
                .healthcareProvidersDetails();
        assertEquals(List.of(1002L, 1000L), details.stream().map(HealthcareProviderDetail::locationId).toList());

        assertThrows(ProviderNotFoundException.class, () -> queryService.getDetails(new HealthcareProviderIdList(List.of(
                new HealthcareProviderId(1000L, 0L), new HealthcareProviderId(9999L, 0L)))));
    }

    @Test
    void restoreRepublishesLastSnapshotFromDisk() {
        assertEquals(Optional.empty(), refreshService.restorePublishedSnapshot());

        feedFetcher.enqueue(ProviderFeedFixtures.csv(5));
        refreshService.runUpdate();
        Path published = queryService.currentSnapshotPath();

        Optional<PublishedSnapshot> restored = refreshService.restorePublishedSnapshot();

        assertEquals(Optional.of(new PublishedSnapshot(published, "2026-3-2")), restored);
    }

    private int countRows(String table) {
        Integer count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return count == null ? 0 : count;
    }

    private List<Path> snapshotFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return new ArrayList<>(files.filter(p -> p.getFileName().toString().endsWith(".zip")).toList());
        }
    }

    private List<Path> allFiles(Path directory) throws IOException {
        try (Stream<Path> files = Files.list(directory)) {
            return files.toList();
        }
    }

    private List<Map<String, Object>> readSnapshot(Path archive) throws IOException {
        try (ZipInputStream zip = new ZipInputStream(Files.newInputStream(archive))) {
            ZipEntry entry = zip.getNextEntry();
            assertEquals("providers.json", entry.getName());
            return objectMapper.readValue(zip.readAllBytes(), new TypeReference<>() {});
        }
    }
}
