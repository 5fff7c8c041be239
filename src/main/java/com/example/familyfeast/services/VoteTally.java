package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import java.util.*;

/** Aggregate view of a batch of votes (usually all votes on one recipe). */
public class VoteTally {
    public final int total;
    public final int score;           // Borda sum; vetoes never contribute
    public final boolean hasVeto;
    public final Map<VoteType, Integer> counts;

    private VoteTally(int total, int score, boolean hasVeto, Map<VoteType, Integer> counts) {
        this.total = total; this.score = score; this.hasVeto = hasVeto; this.counts = counts;
    }

    public static VoteTally of(Collection<Vote> votes) {
        EnumMap<VoteType, Integer> counts = new EnumMap<>(VoteType.class);
        int total = 0, score = 0;
        boolean veto = false;
        if (votes != null) for (Vote v : votes) {
            if (v == null || v.type == null) continue;
            total++;
            counts.merge(v.type, 1, Integer::sum);
            if (v.type.isVeto()) veto = true;
            else score += v.type.points();
        }
        return new VoteTally(total, score, veto, Collections.unmodifiableMap(counts));
    }

    public int count(VoteType type) { return counts.getOrDefault(type, 0); }

    /** Share of like + super_like, 0..100. Zero when there are no votes. */
    public double positivePercentage() {
        if (total == 0) return 0;
        return (count(VoteType.LIKE) + count(VoteType.SUPER_LIKE)) * 100.0 / total;
    }

    /** Share of voters agreeing on the single most common category, 0..100. */
    public double consensusLevel() {
        if (total == 0) return 0;
        int max = 0;
        for (int c : counts.values()) max = Math.max(max, c);
        return max * 100.0 / total;
    }
}
