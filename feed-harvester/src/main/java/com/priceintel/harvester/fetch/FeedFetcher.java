package com.priceintel.harvester.fetch;

import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.TransportKind;

import java.time.Duration;

/**
 * One transport. Implementations must honour the timeout and the byte limit, and must not
 * hold any lock while doing network I/O.
 */
public interface FeedFetcher {

    boolean supports(TransportKind kind);

    RawContent fetch(Feed feed, Duration timeout, long maxBytes);
}
