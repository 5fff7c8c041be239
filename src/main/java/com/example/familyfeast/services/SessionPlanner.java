package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import com.example.familyfeast.storage.VotingSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.*;
import java.util.stream.Collectors;

/** Runs the constrained selection with a session's meal count and budget. */
public class SessionPlanner {
    private static final Logger log = LoggerFactory.getLogger(SessionPlanner.class);

    private final Planner planner;
    private final VotingSettings settings;

    public SessionPlanner() { this(new Planner(), VotingSettings.defaults()); }
    public SessionPlanner(Planner planner, VotingSettings settings) {
        this.planner = planner;
        this.settings = settings.validate();
    }

    /**
     * Every member has voted on every candidate: votes on session candidates reach
     * {@code totalMembers * candidates}. A session without candidates is never complete.
     */
    public boolean isVotingComplete(MealSession session, List<Vote> votes, int totalMembers) {
        Objects.requireNonNull(session, "session must not be null");
        if (session.candidateRecipeIds == null || session.candidateRecipeIds.isEmpty() || votes == null) return false;
        Set<String> ids = new HashSet<>(session.candidateRecipeIds);
        long cast = votes.stream().filter(v -> v != null && ids.contains(v.recipeId)).count();
        return cast >= (long) totalMembers * ids.size();
    }

    /**
     * Selects the session's meals. Candidates are the recipes listed on the session, or all
     * supplied recipes when the session lists none. The session itself is not modified.
     *
     * @throws IllegalStateException unless the session is voting or finalizing
     */
    public SessionPlan plan(MealSession session, List<Recipe> recipes, List<Vote> votes) {
        Objects.requireNonNull(session, "session must not be null");
        if (session.status == null || !session.status.acceptsPlanning())
            throw new IllegalStateException("Session " + session.id + " cannot be planned while " + session.status);

        List<Recipe> candidates = candidates(session, recipes);
        int meals = session.numberOfMeals > 0 ? session.numberOfMeals : settings.defaultMealCount;
        List<Recipe> selected = planner.plan(candidates, votes, meals, session.budgetLimit, true);

        int cost = selected.stream().mapToInt(Recipe::costOrZero).sum();
        Integer remaining = session.budgetLimit == null ? null : session.budgetLimit - cost;
        BudgetStatus status = BudgetStatus.evaluate(session.budgetLimit, cost, settings.nearBudgetRatio);
        log.debug("Session {}: {} of {} meals selected, cost {} ({})", session.id, selected.size(), meals, cost, status);
        return new SessionPlan(session.id, selected, cost, remaining, status);
    }

    private static List<Recipe> candidates(MealSession session, List<Recipe> recipes) {
        if (recipes == null) return List.of();
        if (session.candidateRecipeIds == null || session.candidateRecipeIds.isEmpty()) return recipes;
        Set<String> ids = new HashSet<>(session.candidateRecipeIds);
        return recipes.stream().filter(r -> r.id != null && ids.contains(r.id)).collect(Collectors.toList());
    }
}
