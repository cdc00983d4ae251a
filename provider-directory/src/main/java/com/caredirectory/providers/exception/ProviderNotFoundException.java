package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

public class ProviderNotFoundException extends ProviderDirectoryException {

    public ProviderNotFoundException(Long locationId, Long institutionId) {
        super(HttpStatus.NOT_FOUND, "PROVIDER_NOT_FOUND",
                "The healthcare provider with ID (" + locationId + ", " + institutionId + ") not found.");
    }
}
