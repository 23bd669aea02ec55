package com.fry.backend.service;

import com.fry.backend.dto.PatternAnalysis;
import com.fry.backend.dto.PatternAnalysis.PrimaryPainSource;
import com.fry.backend.model.BehaviorPattern;
import com.fry.backend.model.PainBreakdown;
import com.fry.backend.model.PainLevel;
import com.fry.backend.model.PainScore;
import com.fry.backend.model.PainSource;
import com.fry.backend.model.RiskProfile;
import com.fry.backend.model.Sustainability;
import com.fry.backend.model.TraderTier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Derives qualitative labels and insight strings from one scored loss. The behavior and insight
 * cascades are ordered rule lists; for behavior the first matching rule wins.
 */
@Service
public class PatternInsightAnalyzer {

    private static final double BASE_RECOVERY = 0.5;
    private static final double CONCENTRATION_ALERT = 0.8;
    private static final double LOW_RECOVERY = 0.3;

    private static final List<Rule<PainScore, BehaviorPattern>> BEHAVIOR_RULES = List.of(
            new Rule<>((PainScore s) -> s.breakdown().leverageFactor() > 10 && s.breakdown().positionRisk() > 0.5,
                    BehaviorPattern.DEGENERATE_GAMBLER),
            new Rule<>((PainScore s) -> s.breakdown().frequencyMultiplier() > 3, BehaviorPattern.COMPULSIVE_TRADER),
            new Rule<>((PainScore s) -> s.breakdown().positionRisk() > 0.8, BehaviorPattern.ALL_IN_ADDICT),
            new Rule<>((PainScore s) -> s.traderTier() == TraderTier.WHALE && s.breakdown().leverageFactor() < 2,
                    BehaviorPattern.CONSERVATIVE_WHALE),
            new Rule<>((PainScore s) -> s.traderTier() == TraderTier.SHRIMP && s.breakdown().leverageFactor() > 5,
                    BehaviorPattern.DESPERATE_SHRIMP)
    );

    private static final List<Rule<InsightContext, String>> INSIGHT_RULES = List.of(
            new Rule<>((InsightContext i) -> i.score().painLevel() == PainLevel.EXCRUCIATING,
                    "CRITICAL: This trader is experiencing maximum pain"),
            new Rule<>((InsightContext i) -> i.score().traderTier() == TraderTier.SHRIMP && i.score().painMultiplier() > 20,
                    "Shrimp in severe distress - likely to capitulate"),
            new Rule<>((InsightContext i) -> i.score().traderTier() == TraderTier.WHALE && i.score().painMultiplier() > 5,
                    "Whale feeling pain - rare occurrence, market impact likely"),
            new Rule<>((InsightContext i) -> i.pattern() == BehaviorPattern.DEGENERATE_GAMBLER,
                    "Degenerate gambling pattern detected - intervention needed"),
            new Rule<>((InsightContext i) -> i.riskProfile() == RiskProfile.EXTREME_RISK,
                    "Extreme risk profile - account destruction imminent"),
            new Rule<>((InsightContext i) -> i.recoveryLikelihood() < LOW_RECOVERY,
                    "Low recovery probability - potential permanent exit"),
            new Rule<>((InsightContext i) -> i.networkConcentration() > CONCENTRATION_ALERT,
                    "Pain highly concentrated in retail - potential capitulation event")
    );

    public PatternAnalysis analyze(PainScore score) {
        return analyze(score, 0.0);
    }

    /**
     * @param networkPainConcentration current network-wide retail pain share, used for the concentration insight
     */
    public PatternAnalysis analyze(PainScore score, double networkPainConcentration) {
        PainBreakdown breakdown = score.breakdown();
        PrimaryPainSource primary = primaryPainSource(breakdown);
        BehaviorPattern pattern = behaviorPattern(score);
        double riskScore = riskScore(breakdown);
        RiskProfile riskProfile = riskProfile(riskScore);
        Sustainability sustainability = sustainability(score.traderTier(), score.painMultiplier());
        double recovery = recoveryLikelihood(score.traderTier(), breakdown);

        InsightContext context = new InsightContext(score, pattern, riskProfile, recovery, networkPainConcentration);
        List<String> insights = new ArrayList<>();
        for (Rule<InsightContext, String> rule : INSIGHT_RULES) {
            if (rule.when().test(context)) {
                insights.add(rule.result());
            }
        }

        return new PatternAnalysis(primary, pattern, riskProfile, riskScore, sustainability, recovery, List.copyOf(insights));
    }

    PrimaryPainSource primaryPainSource(PainBreakdown breakdown) {
        PainSource strongest = null;
        double strongestIntensity = Double.NEGATIVE_INFINITY;
        for (PainSource source : PainSource.values()) {
            double intensity = source.intensity(breakdown);
            if (intensity > strongestIntensity) {
                strongest = source;
                strongestIntensity = intensity;
            }
        }
        return new PrimaryPainSource(strongest, strongestIntensity, strongest.describe(strongestIntensity));
    }

    BehaviorPattern behaviorPattern(PainScore score) {
        return BEHAVIOR_RULES.stream()
                .filter(rule -> rule.when().test(score))
                .map(Rule::result)
                .findFirst()
                .orElse(BehaviorPattern.STANDARD_RETAIL);
    }

    double riskScore(PainBreakdown breakdown) {
        return (breakdown.leverageFactor() / 10.0) * 0.4
                + breakdown.positionRisk() * 0.3
                + (breakdown.frequencyMultiplier() / 5.0) * 0.2
                + (breakdown.volatilityFactor() / 3.0) * 0.1;
    }

    RiskProfile riskProfile(double riskScore) {
        if (riskScore > 2) return RiskProfile.EXTREME_RISK;
        if (riskScore > 1.5) return RiskProfile.HIGH_RISK;
        if (riskScore > 1) return RiskProfile.MODERATE_RISK;
        return RiskProfile.LOW_RISK;
    }

    Sustainability sustainability(TraderTier tier, double painMultiplier) {
        double tolerance = switch (tier) {
            case WHALE -> 50.0;
            case FISH -> 20.0;
            case RETAIL -> 10.0;
            default -> 5.0;
        };
        double ratio = tolerance / painMultiplier;
        if (ratio > 2) return Sustainability.SUSTAINABLE;
        if (ratio > 1) return Sustainability.MANAGEABLE;
        if (ratio > 0.5) return Sustainability.CONCERNING;
        return Sustainability.UNSUSTAINABLE;
    }

    double recoveryLikelihood(TraderTier tier, PainBreakdown breakdown) {
        double recovery = BASE_RECOVERY;
        switch (tier) {
            case WHALE -> recovery += 0.3;
            case FISH -> recovery += 0.1;
            case SHRIMP -> recovery -= 0.2;
            default -> { }
        }

        if (breakdown.leverageFactor() < 2) {
            recovery += 0.2;
        } else if (breakdown.leverageFactor() > 10) {
            recovery -= 0.3;
        }

        if (breakdown.positionRisk() < 0.2) {
            recovery += 0.1;
        } else if (breakdown.positionRisk() > 0.8) {
            recovery -= 0.2;
        }
        return Math.max(0.0, Math.min(1.0, recovery));
    }

    private record Rule<I, R>(Predicate<I> when, R result) {}

    private record InsightContext(
            PainScore score,
            BehaviorPattern pattern,
            RiskProfile riskProfile,
            double recoveryLikelihood,
            double networkConcentration
    ) {}
}
