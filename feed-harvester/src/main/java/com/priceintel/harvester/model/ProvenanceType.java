package com.priceintel.harvester.model;

/** Which kind of run produced a price observation. */
public enum ProvenanceType {
    SCHEDULED, MANUAL, REPROCESS
}
