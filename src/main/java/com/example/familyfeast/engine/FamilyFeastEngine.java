package com.example.familyfeast.engine;

import com.example.familyfeast.model.*;
import com.example.familyfeast.services.*;
import com.example.familyfeast.storage.VotingSettings;

import java.util.*;

/**
 * Single entry point for the host app. Stateless apart from its settings, so one instance can be
 * shared across threads; every call works on the caller's snapshot and never modifies it.
 */
public class FamilyFeastEngine {
    private final VotingSettings settings;
    private final ScoringEngine scoring;
    private final PairwiseMatrixBuilder pairwise;
    private final SchulzeRanker schulze;
    private final ConsensusCalculator consensus;
    private final Planner planner;
    private final SessionPlanner sessions;

    public FamilyFeastEngine() { this(VotingSettings.defaults()); }

    public FamilyFeastEngine(VotingSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null").validate();
        this.scoring = new ScoringEngine();
        this.pairwise = new PairwiseMatrixBuilder();
        this.schulze = new SchulzeRanker(pairwise);
        this.consensus = new ConsensusCalculator(settings);
        this.planner = new Planner(scoring, settings);
        this.sessions = new SessionPlanner(planner, settings);
    }

    public VotingSettings settings() { return settings; }

    public List<ScoredRecipe> score(List<Recipe> recipes, List<Vote> votes) { return scoring.score(recipes, votes); }

    public List<Recipe> selectTop(List<Recipe> recipes, List<Vote> votes, int count) { return scoring.selectTop(recipes, votes, count); }

    public int[][] pairwiseMatrix(List<Recipe> recipes, List<Vote> votes) { return pairwise.build(recipes, votes); }

    public int[][] strongestPaths(int[][] pairwiseMatrix) { return schulze.strongestPaths(pairwiseMatrix); }

    public List<Recipe> schulzeRank(List<Recipe> recipes, List<Vote> votes) { return schulze.rank(recipes, votes); }

    public ConsensusMetrics consensus(Recipe recipe, List<Vote> votes) { return consensus.metrics(recipe, votes); }

    public double recommendationStrength(Recipe recipe, List<Vote> votes) {
        return consensus.metrics(recipe, votes).recommendationStrength(settings);
    }

    public List<Recipe> filterByMinimumConsensus(List<Recipe> recipes, List<Vote> votes) {
        return consensus.filterByMinimumConsensus(recipes, votes);
    }

    public List<Recipe> filterByMinimumConsensus(List<Recipe> recipes, List<Vote> votes, double threshold) {
        return consensus.filterByMinimumConsensus(recipes, votes, threshold);
    }

    public List<Recipe> smartSelect(List<Recipe> recipes, List<Vote> votes, int count) {
        return planner.plan(recipes, votes, count);
    }

    public List<Recipe> smartSelect(List<Recipe> recipes, List<Vote> votes, int count, Integer budgetLimit, boolean preferVariety) {
        return planner.plan(recipes, votes, count, budgetLimit, preferVariety);
    }

    public boolean isVotingComplete(MealSession session, List<Vote> votes, int totalMembers) {
        return sessions.isVotingComplete(session, votes, totalMembers);
    }

    public SessionPlan planSession(MealSession session, List<Recipe> recipes, List<Vote> votes) {
        return sessions.plan(session, recipes, votes);
    }
}
