package com.example.familyfeast.storage;

/**
 * Tunables for the consensus engine. Defaults reproduce the reference scoring exactly;
 * change them only when a household wants different behaviour.
 */
public class VotingSettings {
    // recommendation strength
    public double scoreWeight = 0.4;
    public double consensusWeight = 0.3;
    public double positiveWeight = 0.3;
    public int scoreCap = 20;                 // score at which the normalized score reaches 100

    public double minimumConsensus = 60.0;    // percent

    // variety
    public boolean varietyWeighted = false;   // off: bonus is tracked but never reorders
    public int unseenCuisineBonus = 10;
    public int unseenDifficultyBonus = 5;

    // sessions
    public double nearBudgetRatio = 0.9;
    public int defaultMealCount = 7;

    public static VotingSettings defaults() { return new VotingSettings(); }

    /** @throws IllegalArgumentException naming the first invalid field */
    public VotingSettings validate() {
        if (scoreWeight < 0 || consensusWeight < 0 || positiveWeight < 0)
            throw new IllegalArgumentException("weights must be >= 0");
        if (scoreCap <= 0) throw new IllegalArgumentException("scoreCap must be positive, was " + scoreCap);
        if (minimumConsensus < 0 || minimumConsensus > 100)
            throw new IllegalArgumentException("minimumConsensus must be within 0..100, was " + minimumConsensus);
        if (unseenCuisineBonus < 0 || unseenDifficultyBonus < 0)
            throw new IllegalArgumentException("variety bonuses must be >= 0");
        if (nearBudgetRatio <= 0 || nearBudgetRatio > 1)
            throw new IllegalArgumentException("nearBudgetRatio must be within (0, 1], was " + nearBudgetRatio);
        if (defaultMealCount < 0) throw new IllegalArgumentException("defaultMealCount must be >= 0");
        return this;
    }
}
