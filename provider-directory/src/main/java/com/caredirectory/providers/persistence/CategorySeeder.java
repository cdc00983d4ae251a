package com.caredirectory.providers.persistence;

import com.caredirectory.providers.exception.ProviderPersistenceException;
import com.caredirectory.providers.model.HealthcareCategory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Arrays;
import java.util.List;

/**
 * Replaces healthcare_category with the fixed taxonomy. Runs in its own committed transaction
 * so the categories are durable before the first provider batch references them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CategorySeeder {

    private final HealthcareCategoryRepository categoryRepository;
    private final TransactionTemplate transactionTemplate;

    public void seed() {
        List<String> values = Arrays.stream(HealthcareCategory.values())
                .map(HealthcareCategory::getValue)
                .toList();
        try {
            transactionTemplate.executeWithoutResult(status -> categoryRepository.replaceAll(values));
        } catch (DataAccessException | TransactionException e) {
            throw new ProviderPersistenceException("Healthcare categories could not be saved", e);
        }
        log.info("Seeded {} healthcare categories", values.size());
    }
}
