package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.*;

/**
 * Builds the Schulze input: {@code d[i][j]} is the number of voters who rate recipe i strictly
 * above recipe j. Indices follow the order of the recipe list. A recipe a voter skipped counts
 * as {@link VoteType#OK} for that voter.
 */
public class PairwiseMatrixBuilder {
    private static final Logger log = LoggerFactory.getLogger(PairwiseMatrixBuilder.class);

    /** O(V * N^2) for V distinct voters and N recipes. */
    public int[][] build(List<Recipe> recipes, List<Vote> votes) {
        if (recipes == null) recipes = List.of();
        int n = recipes.size();
        int[][] d = new int[n][n];
        Map<String, Map<String, VoteType>> ballots = ballotsByVoter(votes);

        VoteType[] ballot = new VoteType[n];
        for (Map<String, VoteType> byRecipe : ballots.values()) {
            for (int i = 0; i < n; i++) {
                VoteType t = recipes.get(i).id == null ? null : byRecipe.get(recipes.get(i).id);
                ballot[i] = t == null ? VoteType.OK : t;
            }
            for (int i = 0; i < n; i++)
                for (int j = 0; j < n; j++)
                    if (i != j && ballot[i].prefersOver(ballot[j])) d[i][j]++;
        }
        log.debug("Pairwise matrix built for {} recipes and {} voters", n, ballots.size());
        return d;
    }

    /** Voter -> recipe -> category. When a voter voted twice on a recipe the first vote counts. */
    static Map<String, Map<String, VoteType>> ballotsByVoter(List<Vote> votes) {
        Map<String, Map<String, VoteType>> ballots = new LinkedHashMap<>();
        if (votes == null) return ballots;
        for (Vote v : votes) {
            if (v == null || v.voterId == null || v.recipeId == null || v.type == null) continue;
            ballots.computeIfAbsent(v.voterId, k -> new HashMap<>()).putIfAbsent(v.recipeId, v.type);
        }
        return ballots;
    }
}
