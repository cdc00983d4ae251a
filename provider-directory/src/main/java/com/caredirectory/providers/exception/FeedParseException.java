package com.caredirectory.providers.exception;

import org.springframework.http.HttpStatus;

public class FeedParseException extends ProviderDirectoryException {

    public FeedParseException(String message, Throwable cause) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, "FEED_PARSE_FAILED", message, cause);
    }

    public FeedParseException(String message) {
        this(message, null);
    }
}
