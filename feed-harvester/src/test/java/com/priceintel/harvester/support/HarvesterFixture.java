package com.priceintel.harvester.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.fetch.FetchRouter;
import com.priceintel.harvester.identity.IdentityEngine;
import com.priceintel.harvester.model.Feed;
import com.priceintel.harvester.model.FeedFormat;
import com.priceintel.harvester.model.FeedStatus;
import com.priceintel.harvester.model.FeedType;
import com.priceintel.harvester.model.TransportConfig;
import com.priceintel.harvester.model.TransportKind;
import com.priceintel.harvester.output.PriceWriter;
import com.priceintel.harvester.parser.FeedParser;
import com.priceintel.harvester.parser.SourceRecordMapper;
import com.priceintel.harvester.quarantine.QuarantineService;
import com.priceintel.harvester.quarantine.RecordValidator;
import com.priceintel.harvester.resolver.ProductResolver;
import com.priceintel.harvester.scheduler.FeedRunProcessor;
import com.priceintel.harvester.scheduler.FeedScheduler;
import com.priceintel.harvester.subscription.SubscriptionPolicy;

import java.time.Instant;
import java.util.List;

/**
 * The harvester's components wired by hand over in-memory storage.
 */
public class HarvesterFixture {

    public static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

    public final HarvesterProperties properties = new HarvesterProperties();
    public final MutableClock clock = new MutableClock(START);

    public final InMemoryFeedRepository feeds = new InMemoryFeedRepository();
    public final InMemoryQuarantineRepository quarantine = new InMemoryQuarantineRepository();
    public final InMemoryPriceRepository prices = new InMemoryPriceRepository();
    public final InMemoryCatalogRepository catalog = new InMemoryCatalogRepository();
    public final InMemoryRetailerRepository retailers = new InMemoryRetailerRepository();
    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final RecordingWorkQueue queue = new RecordingWorkQueue();
    public final StaticFeedFetcher fetcher = new StaticFeedFetcher();

    public final IdentityEngine identityEngine = new IdentityEngine();
    public final SourceRecordMapper recordMapper = new SourceRecordMapper();
    public final FeedParser parser = new FeedParser(recordMapper, new ObjectMapper());
    public final PriceWriter priceWriter = new PriceWriter(prices, identityEngine, properties, clock);
    public final QuarantineService quarantineService = new QuarantineService(
            quarantine, new RecordValidator(), recordMapper, priceWriter, queue, properties, clock);
    public final FetchRouter fetchRouter = new FetchRouter(List.of(fetcher), properties);
    public final FeedRunProcessor processor = new FeedRunProcessor(
            feeds, retailers, fetchRouter, parser, identityEngine, quarantineService, priceWriter, queue,
            new SubscriptionPolicy(properties), events, properties, clock);
    public final ProductResolver resolver = new ProductResolver(catalog, prices, properties, clock);
    public final FeedScheduler scheduler = new FeedScheduler(feeds, queue, null, properties, clock);

    /** An enabled retailer CSV feed over HTTP, due now. */
    public Feed feed(String id) {
        Feed feed = Feed.builder()
                .id(id)
                .retailerId("retailer-1")
                .name("Feed " + id)
                .feedType(FeedType.RETAILER)
                .transport(TransportConfig.builder().kind(TransportKind.HTTP).url("https://feeds.example.com/" + id).build())
                .format(FeedFormat.AUTO)
                .scheduleFrequencyHours(6)
                .nextRunAt(clock.instant())
                .status(FeedStatus.ENABLED)
                .build();
        feeds.save(feed);
        return feed;
    }
}
