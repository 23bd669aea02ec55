package com.fry.backend.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of an {@link AccountProfile}. {@code sequence} is the order in which the trader was first seen.
 */
public record AccountSnapshot(
        String traderId,
        long sequence,
        Instant firstSeen,
        double totalDollarLosses,
        double totalPainScore,
        int lossCount,
        double maxEquitySeen,
        double minEquitySeen,
        double avgLeverage,
        double maxPainMultiplier,
        List<LossEvent> recentHistory
) {

    public double avgPainMultiplier() {
        return totalPainScore / Math.max(totalDollarLosses, 1.0);
    }
}
