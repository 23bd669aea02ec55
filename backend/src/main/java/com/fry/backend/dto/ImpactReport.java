package com.fry.backend.dto;

import com.fry.backend.model.TraderTier;

import java.time.Instant;
import java.util.Map;

public record ImpactReport(
        VolatilityEvent event,
        Instant windowStart,
        Instant windowEnd,
        int totalAffectedTraders,
        int totalLosses,
        Map<TraderTier, SegmentImpact> impactBySegment,
        PainConcentration painConcentration
) {

    /**
     * {@code painConcentrationRatio} is retail pain over whale pain and is
     * {@link Double#POSITIVE_INFINITY} when no whale pain fell inside the window.
     */
    public record PainConcentration(
            double retailPainShare,
            double whalePainShare,
            double painConcentrationRatio
    ) {

        public boolean ratioDefined() {
            return Double.isFinite(painConcentrationRatio);
        }
    }
}
