package com.example.familyfeast.services;

import com.example.familyfeast.model.Recipe;
import java.util.List;

/** Outcome of planning a session. Handed to scheduling and shopping-list generation. */
public class SessionPlan {
    public final String sessionId;
    public final List<Recipe> selected;
    public final int estimatedCost;       // cents
    public final Integer remainingBudget; // cents, null without a budget
    public final BudgetStatus budgetStatus;

    public SessionPlan(String sessionId, List<Recipe> selected, int estimatedCost, Integer remainingBudget, BudgetStatus budgetStatus) {
        this.sessionId=sessionId; this.selected=selected; this.estimatedCost=estimatedCost; this.remainingBudget=remainingBudget; this.budgetStatus=budgetStatus;
    }
}
