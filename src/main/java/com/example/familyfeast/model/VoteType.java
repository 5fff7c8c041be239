package com.example.familyfeast.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed set of vote categories. Scored categories carry points; {@link #VETO} carries none
 * and is only ever read through {@link #isVeto()}.
 */
public enum VoteType {
    SUPER_LIKE("super_like", 2),
    LIKE("like", 1),
    OK("ok", 0),
    DISLIKE("dislike", -100),
    VETO("veto", 0);

    private final String wireName;
    private final int points;

    VoteType(String wireName, int points) {
        this.wireName = wireName;
        this.points = points;
    }

    public boolean isVeto() { return this == VETO; }

    public boolean isPositive() { return this == LIKE || this == SUPER_LIKE; }

    /**
     * Points added to a Borda sum.
     * @throws IllegalStateException for {@link #VETO}, which disqualifies instead of scoring
     */
    public int points() {
        if (isVeto()) throw new IllegalStateException("veto has no point value; check isVeto()");
        return points;
    }

    /**
     * True if a voter casting this category ranks the item strictly above one cast as {@code other}.
     * A veto ranks below every scored category; two vetoes tie.
     */
    public boolean prefersOver(VoteType other) {
        if (isVeto()) return false;
        if (other.isVeto()) return true;
        return points > other.points;
    }

    @JsonValue
    public String wireName() { return wireName; }

    /** Accepts wire names plus the camel-case spelling ("superLike") used by older clients. */
    @JsonCreator
    public static VoteType fromWireName(String name) {
        if (name == null) throw new IllegalArgumentException("vote type is required");
        String n = name.trim().replace("-", "_");
        for (VoteType t : values()) {
            if (t.wireName.equalsIgnoreCase(n) || t.name().equalsIgnoreCase(n)) return t;
        }
        if (n.equalsIgnoreCase("superLike")) return SUPER_LIKE;
        throw new IllegalArgumentException("Unknown vote type: " + name);
    }
}
