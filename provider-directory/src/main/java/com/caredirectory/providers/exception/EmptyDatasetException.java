package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

/**
 * The feed parsed to zero providers. Always treated as an upstream failure.
 */
public class EmptyDatasetException extends ProviderDirectoryException {

    public EmptyDatasetException() {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "EMPTY_DATASET", "Data update failed: the open-data feed contained no providers.");
    }
}
