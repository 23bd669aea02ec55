package com.fry.backend.service;

import com.fry.backend.config.PainEngineProperties;
import com.fry.backend.exception.PainValidationException;
import com.fry.backend.model.TraderTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TierClassifier {

    private final PainEngineProperties properties;

    /**
     * Shrimp up to and including shrimpMax, Retail up to and including retailMax,
     * Fish below whaleMin, Whale from whaleMin upwards.
     */
    public TraderTier classify(double equity) {
        if (!Double.isFinite(equity)) {
            throw new PainValidationException("equity", "must be a finite number");
        }
        if (equity < 0) {
            throw new PainValidationException("equity", "must not be negative");
        }
        PainEngineProperties.Tiers tiers = properties.getTiers();
        if (equity <= tiers.getShrimpMax()) {
            return TraderTier.SHRIMP;
        }
        if (equity <= tiers.getRetailMax()) {
            return TraderTier.RETAIL;
        }
        if (equity < tiers.getWhaleMin()) {
            return TraderTier.FISH;
        }
        return TraderTier.WHALE;
    }
}
