package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A feed record that failed validation. Held until corrected and reprocessed, or dismissed.
 *
 * (feedId, matchKey) is unique: the same bad row arriving in a later run refreshes this record
 * instead of creating a second one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class QuarantinedRecord {

    private String id;
    private String feedId;
    private String retailerId;
    private String runId;
    private FeedType feedType;
    private String matchKey;
    private int rowNumber;

    @Builder.Default
    private Map<String, String> rawFields = new LinkedHashMap<>();

    /** Field snapshot keyed by {@code FeedField} name, as parsed. Corrections overlay this. */
    @Builder.Default
    private Map<String, String> parsedFields = new LinkedHashMap<>();

    @Builder.Default
    private List<BlockingError> blockingErrors = new ArrayList<>();

    private QuarantineStatus status;
    private String dismissNote;
    private Instant createdAt;
    private Instant updatedAt;
}
