package com.example.familyfeast.model;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/** A planning round (e.g. "Week of Jan 15") whose candidates are voted on. */
public class MealSession {
    public String id;
    public String name;
    public LocalDate startDate;
    public LocalDate endDate;
    public SessionStatus status = SessionStatus.PLANNING;
    public int numberOfMeals = 7;
    public Integer budgetLimit;               // cents, nullable
    public List<String> candidateRecipeIds = new ArrayList<>();

    public MealSession() {}
    public MealSession(String id, String name, LocalDate startDate, LocalDate endDate, int numberOfMeals, Integer budgetLimit) {
        this.id=id; this.name=name; this.startDate=startDate; this.endDate=endDate; this.numberOfMeals=numberOfMeals; this.budgetLimit=budgetLimit;
    }

    public int durationInDays() {
        if (startDate == null || endDate == null) return 0;
        return (int) ChronoUnit.DAYS.between(startDate, endDate);
    }
}
