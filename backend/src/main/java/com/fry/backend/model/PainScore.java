package com.fry.backend.model;

import java.time.Instant;

public record PainScore(
        String traderId,
        double dollarLoss,
        double painWeightedScore,
        double painMultiplier,
        PainLevel painLevel,
        TraderTier traderTier,
        PainBreakdown breakdown,
        Instant timestamp
) {}
