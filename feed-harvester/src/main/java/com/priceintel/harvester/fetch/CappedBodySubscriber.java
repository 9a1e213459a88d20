package com.priceintel.harvester.fetch;

import java.io.ByteArrayOutputStream;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Flow;

/**
 * Collects an HTTP response body in memory and fails with TOO_LARGE, cancelling the download,
 * as soon as more than maxBytes arrive.
 */
final class CappedBodySubscriber implements HttpResponse.BodySubscriber<byte[]> {

    private final long maxBytes;
    private final FeedFetchException rejection;
    private final CompletableFuture<byte[]> result = new CompletableFuture<>();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private Flow.Subscription subscription;
    private long total;

    private CappedBodySubscriber(long maxBytes, FeedFetchException rejection) {
        this.maxBytes = maxBytes;
        this.rejection = rejection;
    }

    /**
     * Error responses are discarded, leaving the status to the caller. A declared
     * Content-Length above the limit is rejected before any body is read.
     */
    static HttpResponse.BodyHandler<byte[]> handler(long maxBytes) {
        return info -> {
            if (info.statusCode() < 200 || info.statusCode() >= 300) {
                return HttpResponse.BodySubscribers.replacing(new byte[0]);
            }
            long declared = info.headers().firstValueAsLong("Content-Length").orElse(-1);
            if (declared > maxBytes) {
                return new CappedBodySubscriber(maxBytes, new FeedFetchException(FetchFailureKind.TOO_LARGE,
                        "Declared size " + declared + " exceeds limit of " + maxBytes + " bytes"));
            }
            return new CappedBodySubscriber(maxBytes, null);
        };
    }

    @Override
    public CompletionStage<byte[]> getBody() {
        return result;
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (rejection != null) {
            subscription.cancel();
            result.completeExceptionally(rejection);
            return;
        }
        subscription.request(1);
    }

    @Override
    public void onNext(List<ByteBuffer> buffers) {
        if (result.isDone()) return;
        for (ByteBuffer buffer : buffers) {
            total += buffer.remaining();
            if (total > maxBytes) {
                subscription.cancel();
                result.completeExceptionally(new FeedFetchException(FetchFailureKind.TOO_LARGE,
                        "Content exceeds limit of " + maxBytes + " bytes"));
                return;
            }
            byte[] chunk = new byte[buffer.remaining()];
            buffer.get(chunk);
            out.write(chunk, 0, chunk.length);
        }
        subscription.request(1);
    }

    @Override
    public void onError(Throwable throwable) {
        result.completeExceptionally(throwable);
    }

    @Override
    public void onComplete() {
        result.complete(out.toByteArray());
    }
}
