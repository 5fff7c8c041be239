package com.example.familyfeast;

import com.example.familyfeast.model.*;
import com.example.familyfeast.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

public class SchulzeRankerTests {

    private final PairwiseMatrixBuilder pairwise = new PairwiseMatrixBuilder();
    private final SchulzeRanker ranker = new SchulzeRanker(pairwise);

    private static List<Recipe> recipes(String... ids) {
        List<Recipe> out = new ArrayList<>();
        for (String id : ids) out.add(new Recipe(id, "Recipe " + id, null, Difficulty.MEDIUM, null));
        return out;
    }

    @Test
    void unanimousPreferenceOrderIsKept() {
        List<Recipe> rs = recipes("A", "B", "C");
        List<Vote> votes = List.of(
            new Vote("m0", "A", VoteType.SUPER_LIKE), new Vote("m0", "B", VoteType.LIKE), new Vote("m0", "C", VoteType.OK),
            new Vote("m1", "A", VoteType.LIKE), new Vote("m1", "B", VoteType.LIKE), new Vote("m1", "C", VoteType.OK),
            new Vote("m2", "A", VoteType.LIKE), new Vote("m2", "B", VoteType.OK), new Vote("m2", "C", VoteType.DISLIKE));

        int[][] d = pairwise.build(rs, votes);
        assertArrayEquals(new int[]{0, 2, 3}, d[0]);
        assertArrayEquals(new int[]{0, 0, 3}, d[1]);
        assertArrayEquals(new int[]{0, 0, 0}, d[2]);

        List<Recipe> ranked = ranker.rank(rs, votes);
        assertEquals(List.of("A", "B", "C"), ranked.stream().map(r -> r.id).collect(Collectors.toList()));
    }

    @Test
    void skippedRecipesCountAsOkAndVetoRanksBelowDislike() {
        List<Recipe> rs = recipes("X", "Y");
        List<Vote> votes = List.of(
            new Vote("v", "X", VoteType.VETO), new Vote("v", "Y", VoteType.DISLIKE),
            new Vote("w", "X", VoteType.LIKE));
        int[][] d = pairwise.build(rs, votes);
        assertEquals(1, d[0][1]);   // w: like > skipped
        assertEquals(1, d[1][0]);   // v: dislike > veto
    }

    @Test
    void firstVoteOfAVoterOnARecipeIsTheBallot() {
        List<Recipe> rs = recipes("X", "Y");
        List<Vote> votes = List.of(
            new Vote("v", "X", VoteType.LIKE), new Vote("v", "X", VoteType.DISLIKE),
            new Vote(null, "Y", VoteType.SUPER_LIKE));
        int[][] d = pairwise.build(rs, votes);
        assertEquals(1, d[0][1]);
        assertEquals(0, d[1][0]);
    }

    @Test
    void strongestPathsCloseOverIntermediates() {
        int[][] d = {
            {0, 4, 1},
            {2, 0, 5},
            {3, 1, 0}
        };
        int[][] p = ranker.strongestPaths(d);
        assertArrayEquals(new int[]{0, 4, 4}, p[0]);
        assertArrayEquals(new int[]{3, 0, 5}, p[1]);
        assertArrayEquals(new int[]{3, 3, 0}, p[2]);
        assertArrayEquals(new int[]{2, 1, 0}, ranker.wins(p));
        assertEquals(1, d[0][2], "input matrix must not be modified");
    }

    @Test
    void cyclicMajoritiesTieAndKeepInputOrder() {
        int[][] p = ranker.strongestPaths(new int[][]{{0, 3, 1}, {1, 0, 3}, {3, 1, 0}});
        for (int i = 0; i < 3; i++) for (int j = 0; j < 3; j++) assertEquals(i == j ? 0 : 3, p[i][j]);

        List<Recipe> rs = recipes("A", "B", "C");
        List<Vote> votes = List.of(
            new Vote("1", "A", VoteType.SUPER_LIKE), new Vote("1", "B", VoteType.LIKE), new Vote("1", "C", VoteType.OK),
            new Vote("2", "B", VoteType.SUPER_LIKE), new Vote("2", "C", VoteType.LIKE), new Vote("2", "A", VoteType.OK),
            new Vote("3", "C", VoteType.SUPER_LIKE), new Vote("3", "A", VoteType.LIKE), new Vote("3", "B", VoteType.OK));
        assertEquals(List.of("A", "B", "C"), ranker.rank(rs, votes).stream().map(r -> r.id).collect(Collectors.toList()));
    }

    @Test
    void nonSquareMatrixIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ranker.strongestPaths(new int[][]{{0, 1}, {0}}));
    }

    @Test
    void emptyInputRanksNothing() {
        assertTrue(ranker.rank(List.of(), List.of()).isEmpty());
        assertTrue(ranker.rank(null, null).isEmpty());
        assertEquals(0, ranker.strongestPaths(new int[0][0]).length);
    }

    @Test
    void twentyCandidatesRankQuickly() {
        Random rnd = new Random(42);
        List<Recipe> rs = new ArrayList<>();
        List<Vote> votes = new ArrayList<>();
        for (int i = 0; i < 20; i++) rs.add(new Recipe("r" + i, "R" + i, null, Difficulty.EASY, null));
        for (Recipe r : rs) for (int m = 0; m < 10; m++)
            votes.add(new Vote("m" + m, r.id, rnd.nextBoolean() ? VoteType.LIKE : VoteType.OK));

        List<Recipe> ranked = assertTimeout(Duration.ofSeconds(5), () -> ranker.rank(rs, votes));
        assertEquals(20, ranked.size());
        assertEquals(new HashSet<>(rs), new HashSet<>(ranked));
        assertEquals(ranked, ranker.rank(rs, votes));
    }
}
