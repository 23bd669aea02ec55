package com.fry.backend.model;

public record PainBreakdown(
        double leverageFactor,
        double positionRisk,
        double volatilityFactor,
        double timeFactor,
        double wealthAdjustment,
        double frequencyMultiplier
) {}
