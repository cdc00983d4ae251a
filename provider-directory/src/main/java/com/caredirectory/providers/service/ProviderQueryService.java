package com.caredirectory.providers.service;

import com.caredirectory.providers.exception.InvalidProviderIdException;
import com.caredirectory.providers.exception.ProviderNotFoundException;
import com.caredirectory.providers.model.HealthcareProviderDetail;
import com.caredirectory.providers.model.HealthcareProviderDetailList;
import com.caredirectory.providers.model.HealthcareProviderId;
import com.caredirectory.providers.model.HealthcareProviderIdList;
import com.caredirectory.providers.model.HealthcareProvider;
import com.caredirectory.providers.model.UpdateStatus;
import com.caredirectory.providers.persistence.HealthcareProviderRepository;
import com.caredirectory.providers.persistence.UpdateLedger;
import com.caredirectory.providers.snapshot.PublicationGate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Read paths. Detail lookups go to live storage and ignore the refresh flag; bulk data is only
 * served through the publication gate.
 */
@Service
@RequiredArgsConstructor
public class ProviderQueryService {

    private final HealthcareProviderRepository providerRepository;
    private final UpdateLedger updateLedger;
    private final PublicationGate publicationGate;

    public Path currentSnapshotPath() {
        return publicationGate.currentSnapshotPath();
    }

    public HealthcareProviderDetail getDetail(HealthcareProviderId id) {
        if (id == null || id.locationId() == null || id.institutionId() == null) {
            throw new InvalidProviderIdException();
        }
        return providerRepository.findById(id)
                .map(HealthcareProvider::details)
                .orElseThrow(() -> new ProviderNotFoundException(id.locationId(), id.institutionId()));
    }

    /**
     * Looks up every id in input order. Fails as a whole on the first missing or malformed id.
     */
    public HealthcareProviderDetailList getDetails(HealthcareProviderIdList ids) {
        List<HealthcareProviderId> requested = ids.providersIds() == null ? List.of() : ids.providersIds();
        return new HealthcareProviderDetailList(requested.stream().map(this::getDetail).toList());
    }

    public UpdateStatus getStatus() {
        return new UpdateStatus(updateLedger.currentUpdateLabel(), publicationGate.isUpdating());
    }
}
