package com.fry.backend.model;

public enum RiskProfile {
    EXTREME_RISK("Extreme Risk"),
    HIGH_RISK("High Risk"),
    MODERATE_RISK("Moderate Risk"),
    LOW_RISK("Low Risk");

    private final String label;

    RiskProfile(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
