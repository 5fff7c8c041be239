package com.example.familyfeast.model;
import java.util.ArrayList;
import java.util.List;

public class Recipe {
    public String id;
    public String title;
    public String cuisine;                    // nullable
    public Difficulty difficulty = Difficulty.MEDIUM;
    public int servings = 4;
    public Integer estimatedCostPerServing;   // cents, nullable
    public Integer totalEstimatedCost;        // cents, nullable; derived from per-serving cost when absent
    public List<String> tags = new ArrayList<>();
    public Recipe() {}
    public Recipe(String id, String title, String cuisine, Difficulty difficulty, Integer totalEstimatedCost) {
        this.id=id; this.title=title; this.cuisine=cuisine; this.difficulty=difficulty; this.totalEstimatedCost=totalEstimatedCost;
    }

    /** Explicit total if set, else per-serving cost times servings, else null. */
    public Integer estimatedTotalCost() {
        if (totalEstimatedCost != null) return totalEstimatedCost;
        if (estimatedCostPerServing != null) return estimatedCostPerServing * servings;
        return null;
    }

    public int costOrZero() {
        Integer c = estimatedTotalCost();
        return c == null ? 0 : c;
    }

    public String cuisineOrUnknown() {
        return (cuisine == null || cuisine.isBlank()) ? "unknown" : cuisine.toLowerCase();
    }

    @Override public String toString() { return title != null ? title : id; }
}
