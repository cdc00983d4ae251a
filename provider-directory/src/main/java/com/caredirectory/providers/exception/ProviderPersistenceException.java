package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

public class ProviderPersistenceException extends ProviderDirectoryException {

    public ProviderPersistenceException(String message, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "PERSISTENCE_FAILED", message, cause);
    }
}
