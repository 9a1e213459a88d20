package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only operator edit to one field of a quarantined record. Latest per field wins.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedCorrection {

    private String id;
    private String quarantinedRecordId;
    private String field;
    private String oldValue;
    private String newValue;
    private String author;
    private Instant createdAt;
}
