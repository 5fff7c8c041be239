package com.example.familyfeast.services;

import java.util.Locale;

/** Where an estimated spend sits against a session budget. */
public final class BudgetStatus {
    public enum Level { NO_BUDGET, UNDER_BUDGET, NEAR_LIMIT, OVER_BUDGET }

    public final Level level;
    public final int overBy;   // cents, only for OVER_BUDGET

    private BudgetStatus(Level level, int overBy) { this.level = level; this.overBy = overBy; }

    /** NEAR_LIMIT once the estimate is above {@code nearRatio} of the limit. */
    public static BudgetStatus evaluate(Integer budgetLimit, int estimatedCost, double nearRatio) {
        if (budgetLimit == null) return new BudgetStatus(Level.NO_BUDGET, 0);
        if (estimatedCost > budgetLimit) return new BudgetStatus(Level.OVER_BUDGET, estimatedCost - budgetLimit);
        if (estimatedCost > budgetLimit * nearRatio) return new BudgetStatus(Level.NEAR_LIMIT, 0);
        return new BudgetStatus(Level.UNDER_BUDGET, 0);
    }

    public String displayText() {
        switch (level) {
            case NO_BUDGET: return "No budget set";
            case UNDER_BUDGET: return "Under budget";
            case NEAR_LIMIT: return "Near budget limit";
            default: return String.format(Locale.ROOT, "Over budget by $%.2f", overBy / 100.0);
        }
    }

    @Override public String toString() { return displayText(); }
}
