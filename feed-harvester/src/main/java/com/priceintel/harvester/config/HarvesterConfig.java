package com.priceintel.harvester.config;

import com.priceintel.harvester.queue.InMemoryWorkQueue;
import io.github.resilience4j.core.IntervalFunction;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class HarvesterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Webhook client. Feed downloads use the JDK HttpClient instead. */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(30))
                .build();
    }

    /**
     * Workers are started by the job dispatcher once the context is ready; shutdown drains them
     * when the context closes.
     */
    @Bean(destroyMethod = "shutdown")
    public InMemoryWorkQueue workQueue(HarvesterProperties properties) {
        HarvesterProperties.Queue queue = properties.getQueue();
        return new InMemoryWorkQueue(
                queue.getWorkers(),
                queue.getMaxAttempts(),
                IntervalFunction.ofExponentialBackoff(queue.getInitialBackoff(), queue.getBackoffMultiplier()));
    }
}
