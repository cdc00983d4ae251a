package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

/**
 * Base for every failure the directory reports to callers. Carries the HTTP status, a stable
 * error code and a message safe to show to clients; the cause stays server-side.
 */
public class ProviderDirectoryException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public ProviderDirectoryException(HttpStatus status, String errorCode, String message) {
        this(status, errorCode, message, null);
    }

    public ProviderDirectoryException(HttpStatus status, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
