package com.fry.backend.dto;

public record SegmentImpact(
        int affectedTraders,
        int lossCount,
        double totalDollarLoss,
        double totalPainScore,
        double avgPainMultiplier,
        double painPerTrader
) {}
