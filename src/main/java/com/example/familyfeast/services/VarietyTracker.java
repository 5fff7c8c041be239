package com.example.familyfeast.services;

import com.example.familyfeast.model.*;
import java.util.*;

/** Counts cuisines and difficulties already picked, and prices the novelty of the next pick. */
class VarietyTracker {
    private final Map<String, Integer> cuisines = new HashMap<>();
    private final Map<Difficulty, Integer> difficulties = new EnumMap<>(Difficulty.class);
    private final int cuisineBonus;
    private final int difficultyBonus;

    VarietyTracker(int cuisineBonus, int difficultyBonus) {
        this.cuisineBonus = cuisineBonus;
        this.difficultyBonus = difficultyBonus;
    }

    int bonus(Recipe r) {
        int b = 0;
        if (cuisines.getOrDefault(r.cuisineOrUnknown(), 0) == 0) b += cuisineBonus;
        if (difficulties.getOrDefault(difficulty(r), 0) == 0) b += difficultyBonus;
        return b;
    }

    void record(Recipe r) {
        cuisines.merge(r.cuisineOrUnknown(), 1, Integer::sum);
        difficulties.merge(difficulty(r), 1, Integer::sum);
    }

    int distinctCuisines() { return cuisines.size(); }

    private static Difficulty difficulty(Recipe r) { return r.difficulty == null ? Difficulty.MEDIUM : r.difficulty; }
}
