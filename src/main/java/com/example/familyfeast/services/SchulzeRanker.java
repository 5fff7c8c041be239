package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Condorcet ranking by the Schulze method.
 *
 * <p>The strongest-path closure is O(N^3). Fine for the 15-20 recipes of a weekly round; callers
 * should not hand it more than about 50 candidates.
 *
 * <p>Vetoes are not consulted here. Filter vetoed recipes out first if they must not appear.
 */
public class SchulzeRanker {
    private static final Logger log = LoggerFactory.getLogger(SchulzeRanker.class);

    private final PairwiseMatrixBuilder pairwise;

    public SchulzeRanker() { this(new PairwiseMatrixBuilder()); }
    public SchulzeRanker(PairwiseMatrixBuilder pairwise) { this.pairwise = pairwise; }

    /** Floyd-Warshall widest-path closure over a copy of the pairwise matrix. */
    public int[][] strongestPaths(int[][] d) {
        int n = d.length;
        int[][] p = new int[n][];
        for (int i = 0; i < n; i++) {
            if (d[i].length != n) throw new IllegalArgumentException("pairwise matrix must be square, row " + i + " has " + d[i].length + " cells");
            p[i] = d[i].clone();
        }
        for (int k = 0; k < n; k++)
            for (int i = 0; i < n; i++) {
                if (i == k) continue;
                for (int j = 0; j < n; j++) {
                    if (j == i || j == k) continue;
                    p[i][j] = Math.max(p[i][j], Math.min(p[i][k], p[k][j]));
                }
            }
        return p;
    }

    /** wins[i] = number of j beaten by i on strongest paths. */
    public int[] wins(int[][] p) {
        int n = p.length;
        int[] wins = new int[n];
        for (int i = 0; i < n; i++)
            for (int j = 0; j < n; j++)
                if (i != j && p[i][j] > p[j][i]) wins[i]++;
        return wins;
    }

    /** Recipes by Schulze wins, most first. Stable: equal wins keep input order. */
    public List<Recipe> rank(List<Recipe> recipes, List<Vote> votes) {
        if (recipes == null || recipes.isEmpty()) return List.of();
        int[] wins = wins(strongestPaths(pairwise.build(recipes, votes)));
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < recipes.size(); i++) order.add(i);
        order.sort(Comparator.comparingInt((Integer i) -> wins[i]).reversed());
        log.debug("Schulze wins {}", Arrays.toString(wins));
        return order.stream().map(recipes::get).collect(Collectors.toList());
    }
}
