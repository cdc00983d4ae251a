package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

public class SnapshotWriteException extends ProviderDirectoryException {

    public SnapshotWriteException(String message, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "SNAPSHOT_WRITE_FAILED", message, cause);
    }
}
