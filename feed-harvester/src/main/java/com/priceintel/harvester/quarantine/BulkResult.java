package com.priceintel.harvester.quarantine;

/**
 * @param truncated true when more records matched than the per-call limit allowed
 */
public record BulkResult(int affected, boolean truncated) {
}
