package com.priceintel.harvester.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Notification payload handed to the event publisher. Delivery and rendering happen elsewhere.
 */
@Value
@Builder
public class FeedEvent {

    FeedEventType type;
    String feedId;
    String feedName;
    String retailerId;
    String merchantId;
    String runId;
    ErrorCode errorCode;
    String errorMessage;
    int consecutiveFailures;
    Instant lastSuccessAt;
    Instant occurredAt;
}
