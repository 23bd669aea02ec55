package com.fry.backend.service;

import com.fry.backend.config.PainEngineProperties;
import com.fry.backend.exception.PainValidationException;
import com.fry.backend.model.TraderTier;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TierClassifierTest {

    private final TierClassifier classifier = new TierClassifier(new PainEngineProperties());

    @Test
    void boundariesBelongToTheLowerTierExceptWhaleMin() {
        assertThat(classifier.classify(0)).isEqualTo(TraderTier.SHRIMP);
        assertThat(classifier.classify(5_000)).isEqualTo(TraderTier.SHRIMP);
        assertThat(classifier.classify(5_000.01)).isEqualTo(TraderTier.RETAIL);
        assertThat(classifier.classify(50_000)).isEqualTo(TraderTier.RETAIL);
        assertThat(classifier.classify(50_000.01)).isEqualTo(TraderTier.FISH);
        assertThat(classifier.classify(999_999.99)).isEqualTo(TraderTier.FISH);
        assertThat(classifier.classify(1_000_000)).isEqualTo(TraderTier.WHALE);
        assertThat(classifier.classify(1e12)).isEqualTo(TraderTier.WHALE);
    }

    @Test
    void everyNonNegativeEquityMapsToExactlyOneTier() {
        PainEngineProperties.Tiers tiers = new PainEngineProperties().getTiers();
        for (double equity = 0; equity <= 2_000_000; equity += 1_250.5) {
            int matches = 0;
            if (equity <= tiers.getShrimpMax()) matches++;
            if (equity > tiers.getShrimpMax() && equity <= tiers.getRetailMax()) matches++;
            if (equity > tiers.getRetailMax() && equity < tiers.getWhaleMin()) matches++;
            if (equity >= tiers.getWhaleMin()) matches++;
            assertThat(matches).as("equity %s", equity).isEqualTo(1);
            assertThat(classifier.classify(equity)).isNotNull();
        }
    }

    @Test
    void customThresholdsAreHonoured() {
        PainEngineProperties properties = new PainEngineProperties();
        properties.getTiers().setShrimpMax(100);
        properties.getTiers().setRetailMax(1_000);
        properties.getTiers().setWhaleMin(10_000);
        TierClassifier custom = new TierClassifier(properties);

        assertThat(custom.classify(500)).isEqualTo(TraderTier.RETAIL);
        assertThat(custom.classify(10_000)).isEqualTo(TraderTier.WHALE);
    }

    @Test
    void negativeOrNonFiniteEquityIsRejected() {
        assertThatThrownBy(() -> classifier.classify(-1))
                .isInstanceOf(PainValidationException.class)
                .hasMessage("equity must not be negative");
        assertThatThrownBy(() -> classifier.classify(Double.NaN))
                .isInstanceOf(PainValidationException.class);
        assertThatThrownBy(() -> classifier.classify(Double.POSITIVE_INFINITY))
                .isInstanceOf(PainValidationException.class);
    }
}
