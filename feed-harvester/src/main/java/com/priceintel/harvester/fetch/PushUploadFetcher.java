package com.priceintel.harvester.fetch;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.TransportKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.Comparator;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads the most recent file a retailer pushed into {@code <uploadDir>/<feedId>/}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PushUploadFetcher implements FeedFetcher {

    private final HarvesterProperties properties;

    @Override
    public boolean supports(TransportKind kind) {
        return kind == TransportKind.PUSH_UPLOAD;
    }

    @Override
    public RawContent fetch(Feed feed, Duration timeout, long maxBytes) {
        Path dir = Path.of(properties.getFetch().getUploadDir(), feed.getId());
        if (!Files.isDirectory(dir)) {
            throw FeedFetchException.status(404, "No upload directory for feed " + feed.getId());
        }

        try {
            Path latest = newestFile(dir).orElseThrow(() ->
                    FeedFetchException.status(404, "No uploaded file for feed " + feed.getId()));

            if (Files.size(latest) > maxBytes) {
                throw new FeedFetchException(FetchFailureKind.TOO_LARGE,
                        "Upload " + latest.getFileName() + " exceeds limit of " + maxBytes + " bytes");
            }

            log.debug("Reading pushed upload {}", latest);
            try (InputStream in = Files.newInputStream(latest)) {
                return new RawContent(BoundedStreams.readAll(in, maxBytes), null, latest.toString());
            }
        } catch (IOException e) {
            throw new FeedFetchException(FetchFailureKind.CONNECTION, "Could not read upload: " + e.getMessage(), e);
        }
    }

    private Optional<Path> newestFile(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(Files::isRegularFile)
                    .filter(p -> !p.getFileName().toString().startsWith("."))
                    .max(Comparator.comparing(this::lastModified));
        }
    }

    private FileTime lastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            log.debug("Could not stat {}: {}", path, e.getMessage());
            return FileTime.fromMillis(0);
        }
    }
}
