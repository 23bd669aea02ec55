package com.fry.backend.model;

import java.util.function.ToDoubleFunction;

/**
 * Candidate causes of a loss's pain, in tie-break order. Each normalizes its breakdown factor so the
 * six can be compared, and picks one of two descriptions depending on intensity.
 */
public enum PainSource {
    LEVERAGE(PainBreakdown::leverageFactor, 5.0,
            "Excessive leverage addiction", "Moderate leverage use"),
    POSITION_SIZE(breakdown -> breakdown.positionRisk() * 10.0, 3.0,
            "Catastrophic position sizing", "Risky position sizing"),
    VOLATILITY(PainBreakdown::volatilityFactor, 2.5,
            "Caught in volatility storm", "Normal market volatility"),
    TIMING(PainBreakdown::timeFactor, 2.0,
            "Terrible market timing", "Poor entry timing"),
    FREQUENCY(PainBreakdown::frequencyMultiplier, 2.0,
            "Compulsive trading pattern", "Frequent trading"),
    WEALTH(breakdown -> 1.0 / breakdown.wealthAdjustment(), 5.0,
            "Retail trader vulnerability", "Limited capital buffer");

    private final ToDoubleFunction<PainBreakdown> intensity;
    private final double severeAbove;
    private final String severeDescription;
    private final String description;

    PainSource(ToDoubleFunction<PainBreakdown> intensity, double severeAbove,
               String severeDescription, String description) {
        this.intensity = intensity;
        this.severeAbove = severeAbove;
        this.severeDescription = severeDescription;
        this.description = description;
    }

    public double intensity(PainBreakdown breakdown) {
        return intensity.applyAsDouble(breakdown);
    }

    public String describe(double intensity) {
        return intensity > severeAbove ? severeDescription : description;
    }
}
