package com.fry.backend.model;

public enum PainLevel {
    MINIMAL("Minimal", 0.0),
    MILD("Mild", 2.0),
    MODERATE("Moderate", 5.0),
    HIGH("High", 10.0),
    SEVERE("Severe", 20.0),
    AGONIZING("Agonizing", 50.0),
    EXCRUCIATING("Excruciating", 100.0);

    private final String displayName;
    private final double threshold;

    PainLevel(String displayName, double threshold) {
        this.displayName = displayName;
        this.threshold = threshold;
    }

    public String getDisplayName() {
        return displayName;
    }

    public double getThreshold() {
        return threshold;
    }

    public static PainLevel fromMultiplier(double multiplier) {
        PainLevel[] levels = values();
        for (int i = levels.length - 1; i > 0; i--) {
            if (multiplier >= levels[i].threshold) {
                return levels[i];
            }
        }
        return MINIMAL;
    }
}
