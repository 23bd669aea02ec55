package com.fry.backend.dto;

public record SegmentMetrics(
        int traderCount,
        double totalDollarLosses,
        double totalPainScore,
        double avgPainMultiplier,
        double painEfficiency,
        double avgEquity,
        double painShare
) {}
