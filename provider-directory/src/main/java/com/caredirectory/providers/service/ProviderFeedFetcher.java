package com.caredirectory.providers.service;

import java.net.URI;

/**
 * Abstraction for obtaining the raw provider register bytes from any backing source.
 */
public interface ProviderFeedFetcher {

    /**
     * Downloads the whole feed.
     *
     * @throws com.caredirectory.providers.exception.FeedFetchException on network failure,
     *         timeout or a non-200 response
     */
    byte[] fetch(URI feedUrl);
}
