package com.fry.backend.dto;

import com.fry.backend.model.LossEvent;
import com.fry.backend.model.TraderTier;

import java.time.Instant;
import java.util.List;

public record TraderPainProfile(
        String traderId,
        TraderTier tier,
        double totalDollarLosses,
        double totalPainScore,
        int lossCount,
        double avgPainMultiplier,
        EquityRange equityRange,
        double avgLeverage,
        double maxPainMultiplier,
        Instant firstSeen,
        RecentActivity recentActivity,
        PainRank painRank,
        List<LossEvent> recentLosses
) {

    public record EquityRange(double min, double max) {}

    public record RecentActivity(int windowDays, int lossCount, double painScore) {}

    /**
     * {@code percentile} is the share of traders ranked below this one, in percent.
     */
    public record PainRank(int rank, int totalTraders, double percentile) {}
}
