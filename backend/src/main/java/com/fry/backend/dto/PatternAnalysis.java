package com.fry.backend.dto;

import com.fry.backend.model.BehaviorPattern;
import com.fry.backend.model.PainSource;
import com.fry.backend.model.RiskProfile;
import com.fry.backend.model.Sustainability;

import java.util.List;

public record PatternAnalysis(
        PrimaryPainSource primaryPainSource,
        BehaviorPattern behaviorPattern,
        RiskProfile riskProfile,
        double riskScore,
        Sustainability sustainability,
        double recoveryLikelihood,
        List<String> insights
) {

    public record PrimaryPainSource(PainSource source, double intensity, String description) {}
}
