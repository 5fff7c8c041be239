package com.example.familyfeast.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of a meal planning session. */
public enum SessionStatus {
    PLANNING,     // setting up candidates
    VOTING,
    FINALIZING,   // computing winners
    FINALIZED,
    ACTIVE,
    COMPLETED,
    CANCELLED;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }

    public boolean acceptsPlanning() { return this == VOTING || this == FINALIZING; }
}
