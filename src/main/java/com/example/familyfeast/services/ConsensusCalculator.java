package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import com.example.familyfeast.storage.VotingSettings;
import java.util.*;
import java.util.stream.Collectors;

public class ConsensusCalculator {
    private final VotingSettings settings;

    public ConsensusCalculator() { this(VotingSettings.defaults()); }
    public ConsensusCalculator(VotingSettings settings) { this.settings = settings.validate(); }

    /** Metrics over the votes cast on {@code recipe}; all zeros when nobody voted on it. */
    public ConsensusMetrics metrics(Recipe recipe, List<Vote> votes) {
        List<Vote> mine = new ArrayList<>();
        if (recipe != null && recipe.id != null && votes != null)
            for (Vote v : votes) if (v != null && recipe.id.equals(v.recipeId)) mine.add(v);
        return new ConsensusMetrics(VoteTally.of(mine));
    }

    /** Uses the configured minimum consensus (60% by default). */
    public List<Recipe> filterByMinimumConsensus(List<Recipe> recipes, List<Vote> votes) {
        return filterByMinimumConsensus(recipes, votes, settings.minimumConsensus);
    }

    /** Recipes that are not vetoed and whose consensus level is at least {@code threshold}. */
    public List<Recipe> filterByMinimumConsensus(List<Recipe> recipes, List<Vote> votes, double threshold) {
        if (recipes == null) return List.of();
        return recipes.stream()
            .filter(r -> {
                ConsensusMetrics m = metrics(r, votes);
                return !m.hasVeto && m.consensusLevel >= threshold;
            })
            .collect(Collectors.toList());
    }
}
