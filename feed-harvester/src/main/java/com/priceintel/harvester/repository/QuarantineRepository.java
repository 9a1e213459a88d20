package com.priceintel.harvester.repository;

import com.priceintel.harvester.model.FeedCorrection;
import com.priceintel.harvester.model.QuarantineStatus;
import com.priceintel.harvester.model.QuarantinedRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public interface QuarantineRepository {

    /**
     * Inserts the record, or refreshes the data of a QUARANTINED record with the same
     * (feedId, matchKey). RESOLVED and DISMISSED records are terminal: a matching row keeps their
     * stored data, status and note.
     *
     * @return the record as stored
     */
    QuarantinedRecord upsert(QuarantinedRecord record);

    Optional<QuarantinedRecord> findById(String id);

    void update(QuarantinedRecord record);

    /** QUARANTINED records matching the filter, oldest first. */
    List<QuarantinedRecord> findQuarantined(QuarantineFilter filter, int limit);

    int countQuarantined(QuarantineFilter filter);

    /**
     * Moves the given records to {@code status}, touching only rows still QUARANTINED.
     *
     * @return number of rows changed
     */
    int updateStatus(List<String> ids, QuarantineStatus status, String note, Instant at);

    FeedCorrection addCorrection(FeedCorrection correction);

    /** Corrections for a record in the order they were made. */
    List<FeedCorrection> findCorrections(String quarantinedRecordId);
}
