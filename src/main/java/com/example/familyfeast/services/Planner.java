package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import com.example.familyfeast.storage.VotingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Picks the meals for a round: drops vetoed and negatively scored recipes, packs the rest into
 * the budget best-score-first, runs the variety pass and truncates.
 */
public class Planner {
    private static final Logger log = LoggerFactory.getLogger(Planner.class);

    private static final Comparator<ScoredRecipe> BY_SCORE = Comparator.comparingInt((ScoredRecipe s) -> s.score).reversed();

    private final ScoringEngine scoring;
    private final VotingSettings settings;

    public Planner() { this(new ScoringEngine(), VotingSettings.defaults()); }
    public Planner(ScoringEngine scoring, VotingSettings settings) {
        this.scoring = scoring;
        this.settings = settings.validate();
    }

    public List<Recipe> plan(List<Recipe> recipes, List<Vote> votes, int count) {
        return plan(recipes, votes, count, null, true);
    }

    /**
     * @param budgetLimit cents, or null for no limit; recipes without a cost count as free
     * @param preferVariety run the variety pass. It only reorders picks when
     *                      {@link VotingSettings#varietyWeighted} is on
     */
    public List<Recipe> plan(List<Recipe> recipes, List<Vote> votes, int count, Integer budgetLimit, boolean preferVariety) {
        if (count <= 0) return List.of();

        List<ScoredRecipe> pool = scoring.score(recipes, votes).stream()
            .filter(s -> !s.hasVeto)
            .filter(s -> s.score >= 0)
            .collect(Collectors.toList());

        if (budgetLimit != null) pool = fitBudget(pool, budgetLimit, count);
        if (preferVariety) pool = settings.varietyWeighted ? weightedVariety(pool, count) : trackVariety(pool, count);

        List<Recipe> out = pool.stream().limit(count).map(s -> s.recipe).collect(Collectors.toList());
        log.debug("Planned {} of {} recipes (budget={}, variety={})", out.size(), recipes == null ? 0 : recipes.size(), budgetLimit, preferVariety);
        return out;
    }

    /**
     * Greedy, best score first: a recipe that would overflow the budget is skipped and the scan
     * goes on for cheaper ones further down. Not cost-optimal; a lower scored but cheaper
     * combination can fit more meals.
     */
    List<ScoredRecipe> fitBudget(List<ScoredRecipe> pool, int budgetLimit, int count) {
        List<ScoredRecipe> sorted = new ArrayList<>(pool);
        sorted.sort(BY_SCORE);
        List<ScoredRecipe> picked = new ArrayList<>();
        long total = 0;
        for (ScoredRecipe s : sorted) {
            int cost = s.recipe.costOrZero();
            if (total + cost <= budgetLimit) {
                picked.add(s);
                total += cost;
                if (picked.size() >= count) break;
            }
        }
        return picked;
    }

    /** Keeps score order; the bonus is only observed. */
    List<ScoredRecipe> trackVariety(List<ScoredRecipe> pool, int count) {
        List<ScoredRecipe> sorted = new ArrayList<>(pool);
        sorted.sort(BY_SCORE);
        VarietyTracker tracker = new VarietyTracker(settings.unseenCuisineBonus, settings.unseenDifficultyBonus);
        List<ScoredRecipe> picked = new ArrayList<>();
        for (ScoredRecipe s : sorted) {
            if (picked.size() >= count) break;
            int bonus = tracker.bonus(s.recipe);
            log.trace("{} score={} varietyBonus={}", s.recipe, s.score, bonus);
            picked.add(s);
            tracker.record(s.recipe);
        }
        return picked;
    }

    /** Each step takes the highest score + novelty bonus; ties go to the better scored recipe. */
    List<ScoredRecipe> weightedVariety(List<ScoredRecipe> pool, int count) {
        List<ScoredRecipe> remaining = new ArrayList<>(pool);
        remaining.sort(BY_SCORE);
        VarietyTracker tracker = new VarietyTracker(settings.unseenCuisineBonus, settings.unseenDifficultyBonus);
        List<ScoredRecipe> picked = new ArrayList<>();
        while (picked.size() < count && !remaining.isEmpty()) {
            int best = 0, bestValue = Integer.MIN_VALUE;
            for (int i = 0; i < remaining.size(); i++) {
                ScoredRecipe s = remaining.get(i);
                int value = s.score + tracker.bonus(s.recipe);
                if (value > bestValue) { best = i; bestValue = value; }
            }
            ScoredRecipe s = remaining.remove(best);
            picked.add(s);
            tracker.record(s.recipe);
        }
        log.debug("Variety-weighted pick covers {} cuisines", tracker.distinctCuisines());
        return picked;
    }
}
