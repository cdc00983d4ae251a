package com.caredirectory.providers.snapshot;

import com.caredirectory.providers.config.ProviderDirectoryProperties;
import com.caredirectory.providers.exception.ProviderPersistenceException;
import com.caredirectory.providers.exception.SnapshotWriteException;
import com.caredirectory.providers.model.HealthcareProvider;
import com.caredirectory.providers.model.PublishedSnapshot;
import com.caredirectory.providers.model.SimpleHealthcareProvider;
import com.caredirectory.providers.model.StagedSnapshot;
import com.caredirectory.providers.persistence.HealthcareProviderRepository;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Builds the bulk-download archive from stored providers.
 *
 * Output: {directory}/providers-{label}.zip holding one entry, providers.json, a JSON array of
 * {@link SimpleHealthcareProvider}. Providers are read page by page and collected in insertion
 * order with duplicates dropped.
 *
 * {@link #build} only writes a temp file in the snapshot directory. The archive reaches its final
 * name in {@link #promote}, which the refresh cycle calls once the update date is recorded, so a
 * failed cycle never replaces the file being served, even when both share a name.
 */
@Component
@Slf4j
public class SnapshotBuilder {

    public static final String ENTRY_NAME = "providers.json";
    private static final String FILE_PREFIX = "providers-";
    private static final String FILE_SUFFIX = ".zip";

    private final HealthcareProviderRepository providerRepository;
    private final ObjectMapper objectMapper;
    private final ProviderDirectoryProperties properties;
    private final TransactionTemplate readOnlyTransaction;

    public SnapshotBuilder(HealthcareProviderRepository providerRepository,
                           ObjectMapper objectMapper,
                           ProviderDirectoryProperties properties,
                           PlatformTransactionManager transactionManager) {
        this.providerRepository = providerRepository;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.readOnlyTransaction = new TransactionTemplate(transactionManager);
        this.readOnlyTransaction.setReadOnly(true);
        this.readOnlyTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    public Path pathFor(String label) {
        return directory().resolve(FILE_PREFIX + label + FILE_SUFFIX);
    }

    /**
     * Writes the archive for {@code label} to a temp file next to its final path.
     *
     * @throws SnapshotWriteException if the archive cannot be written; nothing at the target
     *         path is touched in either case
     */
    public StagedSnapshot build(String label) {
        LinkedHashSet<SimpleHealthcareProvider> providers = collectProviders();
        Path target = pathFor(label);
        Path staged = write(providers, target);
        log.info("Snapshot for {} staged with {} providers", label, providers.size());
        return new StagedSnapshot(staged, target, label);
    }

    /**
     * Moves a staged archive onto its final path, replacing any file already there.
     *
     * @throws SnapshotWriteException if the move fails; the staged file is deleted
     */
    public PublishedSnapshot promote(StagedSnapshot staged) {
        try {
            moveIntoPlace(staged.stagedPath(), staged.target());
        } catch (IOException e) {
            log.error("Snapshot {} could not be moved into place: {}", staged.target(), e.getMessage());
            deleteTemp(staged.stagedPath());
            throw new SnapshotWriteException("The file cannot be created.", e);
        }
        log.info("Snapshot {} moved into place", staged.target().getFileName());
        return new PublishedSnapshot(staged.target(), staged.label());
    }

    /**
     * Deletes the archive {@code previous} once {@code current} has replaced it.
     */
    public void retire(PublishedSnapshot previous, PublishedSnapshot current) {
        if (previous.path().equals(current.path())) return;
        try {
            if (Files.deleteIfExists(previous.path())) {
                log.info("Deleted previous snapshot {}", previous.path().getFileName());
            }
        } catch (IOException e) {
            log.warn("Could not delete previous snapshot {}: {}", previous.path(), e.getMessage());
        }
    }

    /**
     * Deletes an archive that was staged but never promoted.
     */
    public void discard(StagedSnapshot staged) {
        deleteTemp(staged.stagedPath());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    LinkedHashSet<SimpleHealthcareProvider> collectProviders() {
        int pageSize = properties.getBatchSize();
        try {
            long count = providerRepository.count();
            int pages = (int) ((count + pageSize - 1) / pageSize);
            LinkedHashSet<SimpleHealthcareProvider> providers = new LinkedHashSet<>();

            for (int page = 0; page < pages; page++) {
                int current = page;
                List<HealthcareProvider> rows = readOnlyTransaction.execute(
                        status -> providerRepository.findPage(current, pageSize));
                if (rows != null) {
                    rows.forEach(p -> providers.add(p.simplify()));
                }
            }
            log.debug("Collected {} providers from {} pages", providers.size(), pages);
            return providers;

        } catch (DataAccessException | TransactionException e) {
            throw new ProviderPersistenceException("Providers could not be read for the snapshot", e);
        }
    }

    private Path write(LinkedHashSet<SimpleHealthcareProvider> providers, Path target) {
        Path temp = null;
        try {
            Files.createDirectories(target.getParent());
            temp = Files.createTempFile(target.getParent(), FILE_PREFIX, FILE_SUFFIX + ".tmp");

            try (ZipOutputStream zip = new ZipOutputStream(new BufferedOutputStream(Files.newOutputStream(temp)))) {
                zip.putNextEntry(new ZipEntry(ENTRY_NAME));
                objectMapper.writer()
                        .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                        .writeValue(zip, providers);
                zip.closeEntry();
            }
            return temp;

        } catch (IOException e) {
            log.error("Snapshot {} could not be written: {}", target, e.getMessage());
            deleteTemp(temp);
            throw new SnapshotWriteException("The file cannot be created.", e);
        }
    }

    private void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported in {}, replacing", target.getParent());
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTemp(Path temp) {
        if (temp == null) return;
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            log.warn("Could not delete staged snapshot {}: {}", temp, e.getMessage());
        }
    }

    private Path directory() {
        return Paths.get(properties.getSnapshot().getDirectory()).toAbsolutePath().normalize();
    }
}
