package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

/**
 * Transient: a refresh cycle is running. Callers should retry later.
 */
public class UpdateInProgressException extends ProviderDirectoryException {

    public UpdateInProgressException() {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "UPDATE_IN_PROGRESS", "Server is updating data.");
    }
}
