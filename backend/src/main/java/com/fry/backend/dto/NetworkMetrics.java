package com.fry.backend.dto;

import com.fry.backend.model.TraderTier;

import java.util.List;
import java.util.Map;

/**
 * Network-wide pain by tier. {@code painConcentration} is the retail side's share of retail plus whale pain.
 */
public record NetworkMetrics(
        Map<TraderTier, SegmentMetrics> segments,
        int totalTraders,
        double totalDollarLosses,
        double totalPainScore,
        double painConcentration,
        List<String> insights
) {

    public SegmentMetrics segment(TraderTier tier) {
        return segments.get(tier);
    }
}
