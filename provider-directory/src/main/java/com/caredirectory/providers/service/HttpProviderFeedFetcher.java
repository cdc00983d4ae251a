package com.caredirectory.providers.service;

import com.caredirectory.providers.config.ProviderDirectoryProperties;
import com.caredirectory.providers.exception.FeedFetchException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Downloads the national provider register CSV over HTTP.
 *
 * The register is published as one large file (tens of MB), so the request timeout is generous
 * but finite. It bounds the whole download, body included, so a stalled upstream cannot hold the
 * refresh cycle open.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HttpProviderFeedFetcher implements ProviderFeedFetcher {

    private final HttpClient feedHttpClient;
    private final ProviderDirectoryProperties properties;

    @Override
    @Retry(name = "openDataFeed")
    public byte[] fetch(URI feedUrl) {
        log.info("Downloading provider register from: {}", feedUrl);

        Duration timeout = properties.getFeed().getRequestTimeout();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(feedUrl)
                .timeout(timeout)
                .GET()
                .build();

        // The request timeout only covers the response headers; the deadline below also covers the body.
        CompletableFuture<HttpResponse<byte[]>> download =
                feedHttpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray());
        try {
            HttpResponse<byte[]> response = download.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (response.statusCode() != 200) {
                throw new FeedFetchException("Open data feed returned HTTP " + response.statusCode());
            }
            byte[] body = response.body();
            log.info("Downloaded {} bytes of provider data", body.length);
            return body;

        } catch (TimeoutException e) {
            download.cancel(true);
            throw new FeedFetchException("Open data feed did not finish within " + timeout, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof HttpTimeoutException) {
                throw new FeedFetchException("Open data feed timed out", cause);
            }
            throw new FeedFetchException("Open data feed could not be downloaded", cause);
        } catch (InterruptedException e) {
            download.cancel(true);
            Thread.currentThread().interrupt();
            throw new FeedFetchException("Open data feed download was interrupted", e);
        }
    }
}
