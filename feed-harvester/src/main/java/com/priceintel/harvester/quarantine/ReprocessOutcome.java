package com.priceintel.harvester.quarantine;

import com.priceintel.harvester.model.BlockingError;

import java.util.List;

/**
 * Result of re-validating one quarantined record. sourceProductId is set only when resolved.
 */
public record ReprocessOutcome(String recordId, boolean resolved, String sourceProductId,
                               List<BlockingError> remainingErrors) {

    public static ReprocessOutcome resolved(String recordId, String sourceProductId) {
        return new ReprocessOutcome(recordId, true, sourceProductId, List.of());
    }

    public static ReprocessOutcome stillBlocked(String recordId, List<BlockingError> errors) {
        return new ReprocessOutcome(recordId, false, null, List.copyOf(errors));
    }
}
