package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

public class SnapshotNotAvailableException extends ProviderDirectoryException {

    public SnapshotNotAvailableException() {
        super(HttpStatus.NOT_FOUND, "SNAPSHOT_NOT_AVAILABLE", "No provider snapshot has been published yet.");
    }
}
