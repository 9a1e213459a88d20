package com.priceintel.harvester.fetch;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.TransportConfig;
import com.priceintel.harvester.model.TransportKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.net.ftp.FTP;
import org.apache.commons.net.ftp.FTPClient;
import org.apache.commons.net.ftp.FTPReply;
import org.apache.commons.net.ftp.FTPSClient;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.time.Duration;

/**
 * Pulls a single file over FTP, or FTPS with explicit TLS.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FtpFeedFetcher implements FeedFetcher {

    private static final int DEFAULT_PORT = 21;

    private final HarvesterProperties properties;

    @Override
    public boolean supports(TransportKind kind) {
        return kind == TransportKind.FTP || kind == TransportKind.FTPS;
    }

    @Override
    public RawContent fetch(Feed feed, Duration timeout, long maxBytes) {
        TransportConfig config = feed.getTransport();
        if (StringUtils.isAnyBlank(config.getHost(), config.getPath())) {
            throw new FeedFetchException(FetchFailureKind.CONFIG,
                    "Feed " + feed.getId() + " needs an FTP host and path");
        }

        boolean secure = config.getKind() == TransportKind.FTPS;
        FTPClient client = secure ? new FTPSClient(false) : new FTPClient();
        client.setConnectTimeout((int) properties.getFetch().getConnectTimeout().toMillis());
        client.setDefaultTimeout((int) timeout.toMillis());
        client.setDataTimeout(timeout);

        int port = config.getPort() != null ? config.getPort() : DEFAULT_PORT;
        String source = (secure ? "ftps://" : "ftp://") + config.getHost() + ":" + port + config.getPath();

        try {
            client.connect(config.getHost(), port);
            if (!FTPReply.isPositiveCompletion(client.getReplyCode())) {
                throw FeedFetchException.status(client.getReplyCode(),
                        "FTP server refused connection: " + client.getReplyString().trim());
            }

            String user = StringUtils.defaultIfBlank(config.getUsername(), "anonymous");
            String password = StringUtils.defaultString(config.getPassword());
            if (!client.login(user, password)) {
                throw new FeedFetchException(FetchFailureKind.CONFIG, "FTP login rejected for user " + user);
            }
            if (secure) {
                ((FTPSClient) client).execPBSZ(0);
                ((FTPSClient) client).execPROT("P");
            }
            client.enterLocalPassiveMode();
            client.setFileType(FTP.BINARY_FILE_TYPE);

            log.debug("Retrieving {}", source);
            byte[] bytes;
            try (InputStream in = client.retrieveFileStream(config.getPath())) {
                if (in == null) {
                    throw FeedFetchException.status(client.getReplyCode(),
                            "FTP retrieve failed: " + client.getReplyString().trim());
                }
                bytes = BoundedStreams.readAll(in, maxBytes);
            }
            if (!client.completePendingCommand()) {
                throw FeedFetchException.status(client.getReplyCode(),
                        "FTP transfer incomplete: " + client.getReplyString().trim());
            }
            return new RawContent(bytes, null, source);

        } catch (SocketTimeoutException e) {
            throw new FeedFetchException(FetchFailureKind.TIMEOUT, "FTP timed out: " + source, e);
        } catch (IOException e) {
            throw new FeedFetchException(FetchFailureKind.CONNECTION, "FTP transfer failed: " + e.getMessage(), e);
        } finally {
            disconnect(client);
        }
    }

    private void disconnect(FTPClient client) {
        if (!client.isConnected()) return;
        try {
            client.logout();
            client.disconnect();
        } catch (IOException e) {
            log.debug("FTP disconnect failed: {}", e.getMessage());
        }
    }
}
