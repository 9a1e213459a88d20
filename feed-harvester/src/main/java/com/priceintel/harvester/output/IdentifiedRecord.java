package com.priceintel.harvester.output;

import com.priceintel.harvester.model.IdentityKey;
import com.priceintel.harvester.model.SourceRecord;

/**
 * A validated record paired with the identity it will be stored under.
 */
public record IdentifiedRecord(SourceRecord record, IdentityKey identity) {
}
