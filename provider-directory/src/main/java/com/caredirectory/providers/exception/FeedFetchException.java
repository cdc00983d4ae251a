package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

/**
 * The open-data feed could not be downloaded: network error, timeout or non-200 response.
 */
public class FeedFetchException extends ProviderDirectoryException {

    public FeedFetchException(String message, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "FEED_FETCH_FAILED", message, cause);
    }

    public FeedFetchException(String message) {
        this(message, null);
    }
}
