package com.priceintel.harvester.notification;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.ErrorCode;
import com.priceintel.harvester.model.FeedEvent;
import com.priceintel.harvester.model.FeedEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class WebhookFeedEventPublisherTest {

    private static final String WEBHOOK = "https://hooks.example.com/feeds";

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private HarvesterProperties properties;
    private WebhookFeedEventPublisher publisher;

    private final FeedEvent event = FeedEvent.builder()
            .type(FeedEventType.FEED_AUTO_DISABLED)
            .feedId("feed-1")
            .feedName("Feed feed-1")
            .retailerId("retailer-1")
            .errorCode(ErrorCode.HTTP_STATUS)
            .errorMessage("Feed download failed: HTTP 503")
            .consecutiveFailures(3)
            .occurredAt(Instant.parse("2024-06-01T12:00:00Z"))
            .build();

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        properties = new HarvesterProperties();
        publisher = new WebhookFeedEventPublisher(restTemplate, properties);
    }

    @Test
    @DisplayName("posts the event as JSON to the configured webhook")
    void posts() {
        properties.getNotification().setWebhookUrl(WEBHOOK);
        server.expect(requestTo(WEBHOOK))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.type").value("FEED_AUTO_DISABLED"))
                .andExpect(jsonPath("$.feedId").value("feed-1"))
                .andExpect(jsonPath("$.consecutiveFailures").value(3))
                .andRespond(withSuccess());

        publisher.publish(event);

        server.verify();
    }

    @Test
    @DisplayName("without a webhook the event is only logged")
    void logsOnly() {
        publisher.publish(event);

        server.verify();
    }
}
