package com.priceintel.harvester.notification;

import com.priceintel.harvester.config.HarvesterProperties;
import com.priceintel.harvester.model.FeedEvent;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.Objects;

/**
 * Posts feed events as JSON to the configured webhook.
 *
 * With no webhook configured events are only logged. Transient failures (5xx, I/O) are
 * retried by the "notificationWebhook" Resilience4j instance.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookFeedEventPublisher implements FeedEventPublisher {

    private final RestTemplate restTemplate;
    private final HarvesterProperties properties;

    @Override
    @Retry(name = "notificationWebhook")
    public void publish(FeedEvent event) {
        String url = properties.getNotification().getWebhookUrl();
        if (StringUtils.isBlank(url)) {
            log.info("Feed event {} for feed {} ({}): {}", event.getType(), event.getFeedId(),
                    event.getFeedName(), Objects.toString(event.getErrorMessage(), ""));
            return;
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        restTemplate.postForEntity(url, new HttpEntity<>(event, headers), Void.class);
        log.debug("Delivered {} for feed {} to webhook", event.getType(), event.getFeedId());
    }
}
