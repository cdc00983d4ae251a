package com.caredirectory.providers.config;

import com.caredirectory.providers.exception.ProviderDirectoryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Renders directory failures as {errorCode, errorMessage}. Causes stay in the log.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    public record ErrorResponse(String errorCode, String errorMessage) {}

    @ExceptionHandler(ProviderDirectoryException.class)
    public ResponseEntity<ErrorResponse> handleDirectoryException(ProviderDirectoryException e) {
        if (e.getCause() != null) {
            log.warn("Request failed with {}: {}", e.getErrorCode(), e.getMessage(), e.getCause());
        }
        return ResponseEntity.status(e.getStatus())
                .body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }
}
