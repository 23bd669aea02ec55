package com.fry.backend.service;

import com.fry.backend.dto.PatternAnalysis;
import com.fry.backend.model.BehaviorPattern;
import com.fry.backend.model.PainBreakdown;
import com.fry.backend.model.PainLevel;
import com.fry.backend.model.PainScore;
import com.fry.backend.model.PainSource;
import com.fry.backend.model.RiskProfile;
import com.fry.backend.model.Sustainability;
import com.fry.backend.model.TraderTier;
import org.junit.jupiter.api.Test;

import static com.fry.backend.util.TestLossFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class PatternInsightAnalyzerTest {

    private final PatternInsightAnalyzer analyzer = new PatternInsightAnalyzer();

    @Test
    void behaviorRulesApplyInPriorityOrder() {
        assertThat(analyzer.behaviorPattern(score(TraderTier.SHRIMP, breakdown(31.6, 0.9, 4.0))))
                .isEqualTo(BehaviorPattern.DEGENERATE_GAMBLER);
        assertThat(analyzer.behaviorPattern(score(TraderTier.RETAIL, breakdown(2, 0.9, 3.2))))
                .isEqualTo(BehaviorPattern.COMPULSIVE_TRADER);
        assertThat(analyzer.behaviorPattern(score(TraderTier.RETAIL, breakdown(2, 0.9, 1))))
                .isEqualTo(BehaviorPattern.ALL_IN_ADDICT);
        assertThat(analyzer.behaviorPattern(score(TraderTier.WHALE, breakdown(1.5, 0.3, 1))))
                .isEqualTo(BehaviorPattern.CONSERVATIVE_WHALE);
        assertThat(analyzer.behaviorPattern(score(TraderTier.SHRIMP, breakdown(8, 0.3, 1))))
                .isEqualTo(BehaviorPattern.DESPERATE_SHRIMP);
        assertThat(analyzer.behaviorPattern(score(TraderTier.FISH, breakdown(3, 0.3, 1))))
                .isEqualTo(BehaviorPattern.STANDARD_RETAIL);
    }

    @Test
    void primaryPainSourceIsTheStrongestNormalizedFactor() {
        PatternAnalysis.PrimaryPainSource source = analyzer.primaryPainSource(
                new PainBreakdown(31.6, 0.9, 2.0, 1.08, 9.5, 1.0));

        assertThat(source.source()).isEqualTo(PainSource.LEVERAGE);
        assertThat(source.intensity()).isCloseTo(31.6, offset(1e-9));
        assertThat(source.description()).isEqualTo("Excessive leverage addiction");
    }

    @Test
    void tiedSourcesResolveToTheFirstDeclared() {
        PatternAnalysis.PrimaryPainSource source = analyzer.primaryPainSource(
                new PainBreakdown(1.0, 0.1, 1.0, 1.0, 1.0, 1.0));

        assertThat(source.source()).isEqualTo(PainSource.LEVERAGE);
        assertThat(source.description()).isEqualTo("Moderate leverage use");
    }

    @Test
    void riskScoreWeightsNormalizedFactors() {
        PainBreakdown breakdown = new PainBreakdown(31.6227766, 0.9, 2.0, 1.08, 9.5, 1.0);
        double expected = 3.16227766 * 0.4 + 0.9 * 0.3 + 0.2 * 0.2 + (2.0 / 3.0) * 0.1;

        assertThat(analyzer.riskScore(breakdown)).isCloseTo(expected, offset(1e-9));
        assertThat(analyzer.riskProfile(expected)).isEqualTo(RiskProfile.HIGH_RISK);
        assertThat(analyzer.riskProfile(2.5)).isEqualTo(RiskProfile.EXTREME_RISK);
        assertThat(analyzer.riskProfile(1.2)).isEqualTo(RiskProfile.MODERATE_RISK);
        assertThat(analyzer.riskProfile(1.0)).isEqualTo(RiskProfile.LOW_RISK);
    }

    @Test
    void sustainabilityDependsOnTierTolerance() {
        assertThat(analyzer.sustainability(TraderTier.WHALE, 10)).isEqualTo(Sustainability.SUSTAINABLE);
        assertThat(analyzer.sustainability(TraderTier.RETAIL, 8)).isEqualTo(Sustainability.MANAGEABLE);
        assertThat(analyzer.sustainability(TraderTier.FISH, 30)).isEqualTo(Sustainability.CONCERNING);
        assertThat(analyzer.sustainability(TraderTier.SHRIMP, 586)).isEqualTo(Sustainability.UNSUSTAINABLE);
    }

    @Test
    void recoveryLikelihoodIsClampedToUnitInterval() {
        double worst = analyzer.recoveryLikelihood(TraderTier.SHRIMP, breakdown(1000, 1.0, 5));
        double best = analyzer.recoveryLikelihood(TraderTier.WHALE, breakdown(1.0, 0.05, 1));

        assertThat(worst).isZero();
        assertThat(best).isEqualTo(1.0);
        for (TraderTier tier : TraderTier.values()) {
            for (double leverage = 1; leverage < 200; leverage *= 1.9) {
                for (double position = 0; position <= 1.0; position += 0.25) {
                    assertThat(analyzer.recoveryLikelihood(tier, breakdown(leverage, position, 1))).isBetween(0.0, 1.0);
                }
            }
        }
    }

    @Test
    void distressedShrimpCollectsEveryApplicableInsight() {
        PainScore score = new PainScore("shrimp-1", 500, 293_000, 586, PainLevel.EXCRUCIATING, TraderTier.SHRIMP,
                new PainBreakdown(31.6227766, 0.9, 2.0, 1.083, 9.517, 1.0), T0);

        PatternAnalysis withConcentration = analyzer.analyze(score, 0.95);
        PatternAnalysis withoutConcentration = analyzer.analyze(score);

        assertThat(withConcentration.behaviorPattern()).isEqualTo(BehaviorPattern.DEGENERATE_GAMBLER);
        assertThat(withConcentration.recoveryLikelihood()).isZero();
        assertThat(withConcentration.insights()).containsExactly(
                "CRITICAL: This trader is experiencing maximum pain",
                "Shrimp in severe distress - likely to capitulate",
                "Degenerate gambling pattern detected - intervention needed",
                "Low recovery probability - potential permanent exit",
                "Pain highly concentrated in retail - potential capitulation event");
        assertThat(withoutConcentration.insights()).hasSize(4);
    }

    private static PainBreakdown breakdown(double leverage, double positionRisk, double frequency) {
        return new PainBreakdown(leverage, positionRisk, 1.5, 1.0, 1.0, frequency);
    }

    private static PainScore score(TraderTier tier, PainBreakdown breakdown) {
        return new PainScore("t", 100, 100, 1.0, PainLevel.MINIMAL, tier, breakdown, T0);
    }
}
