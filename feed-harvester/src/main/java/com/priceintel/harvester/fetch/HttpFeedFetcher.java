package com.priceintel.harvester.fetch;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.TransportConfig;
import com.priceintel.harvester.model.TransportKind;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.springframework.stereotype.Component;

import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Pulls feeds over HTTP(S), anonymously or with basic auth. The fetch timeout bounds the
 * whole download, body included.
 */
@Component
@Slf4j
public class HttpFeedFetcher implements FeedFetcher {

    private final HttpClient httpClient;

    public HttpFeedFetcher(HarvesterProperties properties) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(properties.getFetch().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public boolean supports(TransportKind kind) {
        return kind == TransportKind.HTTP || kind == TransportKind.HTTP_BASIC_AUTH;
    }

    @Override
    public RawContent fetch(Feed feed, Duration timeout, long maxBytes) {
        TransportConfig config = feed.getTransport();
        if (StringUtils.isBlank(config.getUrl())) {
            throw new FeedFetchException(FetchFailureKind.CONFIG, "Feed " + feed.getId() + " has no URL");
        }

        URI uri;
        try {
            uri = URI.create(config.getUrl().trim());
        } catch (IllegalArgumentException e) {
            throw new FeedFetchException(FetchFailureKind.CONFIG, "Malformed feed URL: " + config.getUrl(), e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .header("Accept-Encoding", "gzip")
                .GET();

        if (config.getKind() == TransportKind.HTTP_BASIC_AUTH) {
            if (StringUtils.isBlank(config.getUsername())) {
                throw new FeedFetchException(FetchFailureKind.CONFIG,
                        "Feed " + feed.getId() + " uses basic auth but has no username");
            }
            String credentials = config.getUsername() + ":" + StringUtils.defaultString(config.getPassword());
            request.header("Authorization", "Basic "
                    + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
        }

        log.debug("Fetching feed {} from {}", feed.getId(), uri);
        // The request timeout stops at the headers; this deadline covers the body as well
        CompletableFuture<HttpResponse<byte[]>> download =
                httpClient.sendAsync(request.build(), CappedBodySubscriber.handler(maxBytes));
        HttpResponse<byte[]> response;
        try {
            response = download.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            download.cancel(true);
            throw new FeedFetchException(FetchFailureKind.TIMEOUT,
                    "Download did not finish within " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            throw failure(e.getCause(), uri, timeout);
        } catch (InterruptedException e) {
            download.cancel(true);
            Thread.currentThread().interrupt();
            throw new FeedFetchException(FetchFailureKind.CONNECTION, "Download interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw FeedFetchException.status(status, "Feed download failed: HTTP " + status);
        }
        String contentType = response.headers().firstValue("Content-Type").orElse(null);
        return new RawContent(response.body(), contentType, uri.toString());
    }

    private static FeedFetchException failure(Throwable cause, URI uri, Duration timeout) {
        FeedFetchException fetchFailure = ExceptionUtils.throwableOfType(cause, FeedFetchException.class);
        if (fetchFailure != null) {
            return fetchFailure;
        }
        if (ExceptionUtils.throwableOfType(cause, HttpConnectTimeoutException.class) != null) {
            return new FeedFetchException(FetchFailureKind.TIMEOUT, "Connect timed out: " + uri.getHost(), cause);
        }
        if (ExceptionUtils.throwableOfType(cause, HttpTimeoutException.class) != null) {
            return new FeedFetchException(FetchFailureKind.TIMEOUT,
                    "No response within " + timeout.toMillis() + " ms", cause);
        }
        if (ExceptionUtils.throwableOfType(cause, ConnectException.class) != null) {
            return new FeedFetchException(FetchFailureKind.CONNECTION, "Connection refused: " + uri.getHost(), cause);
        }
        return new FeedFetchException(FetchFailureKind.CONNECTION, "Download failed: " + cause.getMessage(), cause);
    }
}
