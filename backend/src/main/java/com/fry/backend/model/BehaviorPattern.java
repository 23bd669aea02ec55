package com.fry.backend.model;

public enum BehaviorPattern {
    DEGENERATE_GAMBLER("Degenerate Gambler"),
    COMPULSIVE_TRADER("Compulsive Trader"),
    ALL_IN_ADDICT("All-In Addict"),
    CONSERVATIVE_WHALE("Conservative Whale"),
    DESPERATE_SHRIMP("Desperate Shrimp"),
    STANDARD_RETAIL("Standard Retail");

    private final String label;

    BehaviorPattern(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
