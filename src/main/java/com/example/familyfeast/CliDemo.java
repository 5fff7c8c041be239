package com.example.familyfeast;

import com.example.familyfeast.engine.FamilyFeastEngine;
import com.example.familyfeast.model.*;
import com.example.familyfeast.services.*;
import com.example.familyfeast.storage.*;
import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Minimal CLI demo: ranks a voting round and prints scores, Schulze order, consensus and the
 * smart selection.
 * <pre>CliDemo [recipes.json votes.json [settings.json]]</pre>
 * Without arguments the bundled sample data is used.
 */
public class CliDemo {
    public static void main(String[] args) throws IOException {
        JsonStorage storage = new JsonStorage();
        List<Recipe> recipes;
        List<Vote> votes;
        if (args.length >= 2) {
            try (InputStream r = Files.newInputStream(Path.of(args[0])); InputStream v = Files.newInputStream(Path.of(args[1]))) {
                recipes = storage.loadRecipes(r);
                votes = storage.loadVotes(v);
            }
        } else {
            try (InputStream r = resource("/sample-data/recipes.json"); InputStream v = resource("/sample-data/votes.json")) {
                recipes = storage.loadRecipes(r);
                votes = storage.loadVotes(v);
            }
        }
        SettingsStorage settingsStorage = new SettingsStorage();
        VotingSettings settings = args.length >= 3 ? settingsStorage.load(Path.of(args[2])) : settingsStorage.load();
        FamilyFeastEngine engine = new FamilyFeastEngine(settings);

        System.out.println("Borda scores:");
        for (ScoredRecipe s : engine.score(recipes, votes))
            System.out.printf(" - %-28s %5d%s%n", s.recipe, s.score, s.hasVeto ? "  (vetoed)" : "");

        System.out.println("\nSchulze ranking:");
        int place = 1;
        for (Recipe r : engine.schulzeRank(recipes, votes)) System.out.println(" " + place++ + ". " + r);

        System.out.println("\nConsensus:");
        for (Recipe r : recipes) {
            ConsensusMetrics m = engine.consensus(r, votes);
            System.out.printf(" - %-28s %s strength=%.1f%n", r, m, m.recommendationStrength(settings));
        }

        Integer budget = budgetOf(recipes);
        List<Recipe> picked = engine.smartSelect(recipes, votes, 3, budget, true);
        System.out.println("\nSmart selection (3 meals, budget " + (budget == null ? "none" : budget + "c") + "):");
        System.out.println(storage.toJson(picked));
    }

    // demo budget: half of what the whole candidate list would cost
    private static Integer budgetOf(List<Recipe> recipes) {
        int total = recipes.stream().mapToInt(Recipe::costOrZero).sum();
        return total == 0 ? null : total / 2;
    }

    private static InputStream resource(String name) throws IOException {
        InputStream in = CliDemo.class.getResourceAsStream(name);
        if (in == null) throw new FileNotFoundException("Missing bundled resource " + name);
        return in;
    }
}
