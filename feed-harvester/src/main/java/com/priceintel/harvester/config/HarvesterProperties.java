package com.priceintel.harvester.config;

import com.priceintel.harvester.model.ConfidenceTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "harvester")
@Data
public class HarvesterProperties {

    private Scheduling scheduling = new Scheduling();
    private Fetch fetch = new Fetch();
    private Parse parse = new Parse();
    private Queue queue = new Queue();
    private Writer writer = new Writer();
    private Quarantine quarantine = new Quarantine();
    private Resolver resolver = new Resolver();
    private Failure failure = new Failure();
    private Subscription subscription = new Subscription();
    private Notification notification = new Notification();

    @Data
    public static class Scheduling {
        private long tickIntervalMs = 60_000;
        private int claimBatchSize = 10;
        private int manualDrainBatchSize = 10;
        private Duration manualClaimTimeout = Duration.ofHours(2);
        private String pruneCron = "0 15 3 * * *";
        private int runRetentionDays = 30;
        private int pruneBatchSize = 1000;
    }

    @Data
    public static class Fetch {
        private Duration scheduledTimeout = Duration.ofSeconds(120);
        private Duration interactiveTimeout = Duration.ofSeconds(10);
        private Duration connectTimeout = Duration.ofSeconds(30);
        private long maxFileSizeBytes = 500L * 1024 * 1024;
        private String uploadDir = "/data/uploads";
    }

    @Data
    public static class Parse {
        private int maxRows = 500_000;
    }

    @Data
    public static class Queue {
        private int workers = 4;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(5);
        private double backoffMultiplier = 2.0;
    }

    @Data
    public static class Writer {
        private Duration heartbeat = Duration.ofHours(24);
    }

    @Data
    public static class Quarantine {
        private int reprocessLimit = 1000;
        private int dismissLimit = 500;
        private int minDismissNoteLength = 10;
        private int minSingleDismissNoteLength = 3;
        private int updateBatchSize = 100;
        private double warningRate = 0.5;
    }

    @Data
    public static class Resolver {
        private String version = "1.2.0";
        private double highThreshold = 0.80;
        private double mediumThreshold = 0.50;
        private double lowThreshold = 0.20;
        private ConfidenceTier matchTier = ConfidenceTier.MEDIUM;
        private double ambiguityGap = 0.03;
        private int candidateLimit = 50;
        private int reresolveLimit = 500;
    }

    @Data
    public static class Failure {
        private int maxConsecutiveFailures = 3;
    }

    @Data
    public static class Subscription {
        private int graceDays = 7;
        private boolean foundingTierExempt = true;
        private Duration notifyInterval = Duration.ofHours(24);
    }

    @Data
    public static class Notification {
        private String webhookUrl = "";
    }
}
