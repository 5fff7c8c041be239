package com.example.familyfeast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/** One voter's opinion of one recipe. Immutable. */
public final class Vote {
    public final String voterId;
    public final String recipeId;
    public final VoteType type;
    public final String comment;      // nullable
    public final Instant timestamp;

    @JsonCreator
    public Vote(@JsonProperty("voterId") String voterId,
                @JsonProperty("recipeId") String recipeId,
                @JsonProperty("type") VoteType type,
                @JsonProperty("comment") String comment,
                @JsonProperty("timestamp") Instant timestamp) {
        this.voterId = voterId;
        this.recipeId = recipeId;
        this.type = type;
        this.comment = comment;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public Vote(String voterId, String recipeId, VoteType type) {
        this(voterId, recipeId, type, null, null);
    }

    @Override public String toString() { return voterId + "->" + recipeId + ":" + (type == null ? "?" : type.wireName()); }
}
