package com.priceintel.harvester.quarantine;

import com.priceintel.harvester.model.BlockingError;

import java.util.List;

public record ValidationResult(List<BlockingError> blockingErrors) {

    public ValidationResult {
        blockingErrors = List.copyOf(blockingErrors);
    }

    public boolean accepted() {
        return blockingErrors.isEmpty();
    }
}
