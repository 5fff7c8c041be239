package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Modified Borda count: each vote adds its category points to its recipe, a single veto
 * disqualifies the recipe outright.
 */
public class ScoringEngine {
    private static final Logger log = LoggerFactory.getLogger(ScoringEngine.class);

    static final Comparator<ScoredRecipe> RANKING = Comparator
            .comparing((ScoredRecipe s) -> s.hasVeto)
            .thenComparing(Comparator.comparingInt((ScoredRecipe s) -> s.score).reversed());

    /**
     * Scores every recipe, non-vetoed first, then by score descending. The sort is stable, so
     * recipes with equal scores keep their input order. Votes for unknown recipes are ignored;
     * duplicate votes from one voter are all counted.
     */
    public List<ScoredRecipe> score(List<Recipe> recipes, List<Vote> votes) {
        if (recipes == null) recipes = List.of();
        Map<String, List<Vote>> byRecipe = groupByRecipe(votes);
        List<ScoredRecipe> out = new ArrayList<>(recipes.size());
        for (Recipe r : recipes) {
            List<Vote> mine = r.id == null ? null : byRecipe.get(r.id);
            VoteTally tally = VoteTally.of(mine);
            out.add(new ScoredRecipe(r, tally.score, tally.hasVeto));
        }
        out.sort(RANKING);
        log.debug("Scored {} recipes from {} votes", out.size(), votes == null ? 0 : votes.size());
        return out;
    }

    /** Best {@code count} recipes that are neither vetoed nor negatively scored. */
    public List<Recipe> selectTop(List<Recipe> recipes, List<Vote> votes, int count) {
        if (count <= 0) return List.of();
        return score(recipes, votes).stream()
            .filter(ScoredRecipe::isEligible)
            .limit(count)
            .map(s -> s.recipe)
            .collect(Collectors.toList());
    }

    static Map<String, List<Vote>> groupByRecipe(List<Vote> votes) {
        Map<String, List<Vote>> map = new HashMap<>();
        if (votes == null) return map;
        for (Vote v : votes) {
            if (v == null || v.recipeId == null) continue;
            map.computeIfAbsent(v.recipeId, k -> new ArrayList<>()).add(v);
        }
        return map;
    }
}
