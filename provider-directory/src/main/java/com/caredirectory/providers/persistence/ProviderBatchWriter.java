package com.caredirectory.providers.persistence;

import com.caredirectory.providers.config.ProviderDirectoryProperties;
import com.caredirectory.providers.exception.ProviderPersistenceException;
import com.caredirectory.providers.model.HealthcareProvider;
import com.caredirectory.providers.service.BatchRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.List;

/**
 * Writes a parsed provider list in fixed-size batches, one transaction per batch.
 *
 * A failing batch aborts the write; batches committed before it stay committed. Storage may
 * then hold a mix of old and new rows until the next successful cycle purges the old ones.
 * Readers of the bulk data never see that mix because they only get published snapshots.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ProviderBatchWriter {

    private final HealthcareProviderRepository providerRepository;
    private final TransactionTemplate transactionTemplate;
    private final ProviderDirectoryProperties properties;

    /**
     * @return number of records written
     * @throws ProviderPersistenceException on the first batch that fails to commit
     */
    public int write(List<HealthcareProvider> providers, String cycleId) {
        if (providers.isEmpty()) return 0;

        int batchSize = properties.getBatchSize();
        List<BatchRange> batches = BatchRange.partition(providers.size(), batchSize);
        log.info("Writing {} providers in {} batches of {}", providers.size(), batches.size(), batchSize);

        for (BatchRange batch : batches) {
            List<HealthcareProvider> slice = providers.subList(batch.start(), batch.end());
            try {
                transactionTemplate.executeWithoutResult(status -> providerRepository.upsertBatch(slice, cycleId));
            } catch (DataAccessException | TransactionException e) {
                log.error("Provider batch {} [{}..{}) failed: {}", batch.index(), batch.start(), batch.end(), e.getMessage());
                throw new ProviderPersistenceException(
                        "Provider batch " + batch.index() + " could not be saved", e);
            }
            log.debug("Wrote batch {}/{}", batch.index() + 1, batches.size());
        }

        log.info("Successfully wrote {} providers", providers.size());
        return providers.size();
    }

    /**
     * Removes rows no longer present in the feed written by {@code cycleId}.
     */
    public int purgeOtherCycles(String cycleId) {
        Integer removed;
        try {
            removed = transactionTemplate.execute(status -> providerRepository.deleteOtherCycles(cycleId));
        } catch (DataAccessException | TransactionException e) {
            throw new ProviderPersistenceException("Outdated providers could not be removed", e);
        }
        int count = removed == null ? 0 : removed;
        log.info("Removed {} providers missing from the latest feed", count);
        return count;
    }
}
