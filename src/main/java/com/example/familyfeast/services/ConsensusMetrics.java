package com.example.familyfeast.services;

import com.example.familyfeast.model.VoteType;
import com.example.familyfeast.storage.VotingSettings;
import java.util.Locale;
import java.util.Map;

/** Agreement breakdown for one recipe. */
public class ConsensusMetrics {
    public final int totalVotes;
    public final int score;
    public final double consensusLevel;       // 0..100, higher = more agreement
    public final double positivePercentage;   // 0..100, like + super_like
    public final boolean hasVeto;
    public final Map<VoteType, Integer> voteCounts;

    public ConsensusMetrics(VoteTally tally) {
        this.totalVotes = tally.total;
        this.score = tally.score;
        this.consensusLevel = tally.consensusLevel();
        this.positivePercentage = tally.positivePercentage();
        this.hasVeto = tally.hasVeto;
        this.voteCounts = tally.counts;
    }

    public double recommendationStrength() { return recommendationStrength(VotingSettings.defaults()); }

    /**
     * 0..100. Zero when vetoed, otherwise a weighted blend of the score (clamped to
     * {@code 0..scoreCap} and scaled to 0..100), the consensus level and the positive share.
     */
    public double recommendationStrength(VotingSettings s) {
        if (hasVeto) return 0;
        double normalizedScore = Math.max(0, Math.min(score, s.scoreCap)) * 100.0 / s.scoreCap;
        return normalizedScore * s.scoreWeight
             + consensusLevel * s.consensusWeight
             + positivePercentage * s.positiveWeight;
    }

    public String describe() {
        return String.format(Locale.ROOT,
            "Total Votes: %d%nBorda Score: %d%nConsensus Level: %.1f%%%nPositive: %.1f%%%nVetoed: %b",
            totalVotes, score, consensusLevel, positivePercentage, hasVeto);
    }

    @Override public String toString() {
        return String.format(Locale.ROOT, "votes=%d score=%d consensus=%.1f%% positive=%.1f%%%s",
            totalVotes, score, consensusLevel, positivePercentage, hasVeto ? " VETO" : "");
    }
}
