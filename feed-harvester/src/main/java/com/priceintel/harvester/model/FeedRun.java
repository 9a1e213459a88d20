package com.priceintel.harvester.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One execution of a feed. Created as RUNNING, finalized as SUCCEEDED or FAILED.
 * Terminal runs are pruned after the retention window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedRun {

    private String id;
    private String feedId;
    private TriggerType trigger;
    private RunStatus status;
    private Instant startedAt;
    private Instant finishedAt;

    private int rowsRead;
    private int rowsParsed;
    private int rowCount;               // source products written
    private int pricesWritten;
    private int quarantinedCount;
    private int errorCount;

    private ErrorCode primaryErrorCode; // null on clean success
    private String errorMessage;
    private String skippedReason;       // e.g. UNCHANGED_HASH

    @Builder.Default
    private List<ParseError> parseErrors = new ArrayList<>();

    public boolean isTerminal() {
        return status == RunStatus.SUCCEEDED || status == RunStatus.FAILED;
    }
}
