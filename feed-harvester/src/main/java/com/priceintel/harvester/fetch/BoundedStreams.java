package com.priceintel.harvester.fetch;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

final class BoundedStreams {

    private static final int BUFFER_SIZE = 65536;

    private BoundedStreams() {
    }

    /**
     * Reads the stream fully, failing with TOO_LARGE as soon as more than maxBytes arrive.
     */
    static byte[] readAll(InputStream in, long maxBytes) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buffer = new byte[BUFFER_SIZE];
        long total = 0;
        int n;
        while ((n = in.read(buffer)) != -1) {
            total += n;
            if (total > maxBytes) {
                throw new FeedFetchException(FetchFailureKind.TOO_LARGE,
                        "Content exceeds limit of " + maxBytes + " bytes");
            }
            out.write(buffer, 0, n);
        }
        return out.toByteArray();
    }
}
