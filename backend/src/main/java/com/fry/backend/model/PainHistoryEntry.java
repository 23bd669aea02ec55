package com.fry.backend.model;

import java.time.Instant;

public record PainHistoryEntry(
        Instant timestamp,
        double dollarLoss,
        double painWeightedScore,
        double painMultiplier
) {

    public static PainHistoryEntry of(PainScore score) {
        return new PainHistoryEntry(score.timestamp(), score.dollarLoss(), score.painWeightedScore(), score.painMultiplier());
    }
}
