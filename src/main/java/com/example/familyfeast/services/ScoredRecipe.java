package com.example.familyfeast.services;

import com.example.familyfeast.model.Recipe;

public class ScoredRecipe {
    public final Recipe recipe;
    public final int score;
    public final boolean hasVeto;
    public ScoredRecipe(Recipe recipe, int score, boolean hasVeto){ this.recipe=recipe; this.score=score; this.hasVeto=hasVeto; }

    /** Not vetoed and not pushed negative by a dislike. */
    public boolean isEligible() { return !hasVeto && score >= 0; }

    @Override public String toString(){ return recipe + "," + score + (hasVeto ? ",veto" : ""); }
}
