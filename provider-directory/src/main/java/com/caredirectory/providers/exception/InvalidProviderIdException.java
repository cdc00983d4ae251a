package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

/**
 * A lookup key is missing or has an empty component.
 */
public class InvalidProviderIdException extends ProviderDirectoryException {

    public InvalidProviderIdException() {
        super(HttpStatus.BAD_REQUEST, "INVALID_PROVIDER_ID",
                "Provider ID needs both locationId and institutionId.");
    }
}
