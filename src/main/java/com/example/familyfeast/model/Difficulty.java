package com.example.familyfeast.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Difficulty {
    EASY, MEDIUM, HARD;

    @JsonValue
    public String wireName() { return name().toLowerCase(); }
}
