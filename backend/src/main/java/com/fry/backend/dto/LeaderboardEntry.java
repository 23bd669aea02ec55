package com.fry.backend.dto;

import com.fry.backend.model.TraderTier;

public record LeaderboardEntry(
        int rank,
        String traderId,
        TraderTier tier,
        double totalDollarLosses,
        double totalPainScore,
        double avgPainMultiplier,
        int lossCount,
        double maxEquity,
        double avgLeverage,
        double maxPainMultiplier
) {}
