package com.fry.backend.service;

import com.fry.backend.dto.ImpactReport;
import com.fry.backend.dto.ImpactReport.PainConcentration;
import com.fry.backend.dto.SegmentImpact;
import com.fry.backend.dto.VolatilityEvent;
import com.fry.backend.exception.PainValidationException;
import com.fry.backend.model.AccountHistory;
import com.fry.backend.model.PainHistoryEntry;
import com.fry.backend.model.TraderTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class VolatilityEventAnalyzer {

    private static final long MILLIS_PER_HOUR = Duration.ofHours(1).toMillis();

    private final TierClassifier tierClassifier;

    /**
     * Segments every loss recorded in {@code [now - timeWindowHours, now]} by the owning trader's tier.
     */
    public ImpactReport analyzeImpact(VolatilityEvent event, Collection<AccountHistory> accounts, Instant now) {
        if (event == null) {
            throw new PainValidationException("event", "must not be null");
        }
        if (!Double.isFinite(event.timeWindowHours()) || event.timeWindowHours() <= 0) {
            throw new PainValidationException("timeWindowHours", "must be greater than 0");
        }
        Instant windowStart = now.minusMillis(Math.round(event.timeWindowHours() * MILLIS_PER_HOUR));

        Map<TraderTier, Accumulator> accumulators = new EnumMap<>(TraderTier.class);
        for (TraderTier tier : TraderTier.values()) {
            accumulators.put(tier, new Accumulator());
        }
        int totalLosses = 0;
        int totalAffected = 0;
        for (AccountHistory history : accounts) {
            List<PainHistoryEntry> inWindow = history.entries().stream()
                    .filter(entry -> !entry.timestamp().isBefore(windowStart) && !entry.timestamp().isAfter(now))
                    .toList();
            if (inWindow.isEmpty()) {
                continue;
            }
            Accumulator accumulator = accumulators.get(tierClassifier.classify(history.account().maxEquitySeen()));
            accumulator.traders++;
            for (PainHistoryEntry entry : inWindow) {
                accumulator.lossCount++;
                accumulator.dollarLoss += entry.dollarLoss();
                accumulator.painScore += entry.painWeightedScore();
            }
            totalLosses += inWindow.size();
            totalAffected++;
        }

        Map<TraderTier, SegmentImpact> impact = new EnumMap<>(TraderTier.class);
        accumulators.forEach((tier, accumulator) -> impact.put(tier, accumulator.toImpact()));

        double retailPain = impact.get(TraderTier.SHRIMP).totalPainScore() + impact.get(TraderTier.RETAIL).totalPainScore();
        double whalePain = impact.get(TraderTier.WHALE).totalPainScore();

        log.info("Volatility impact asset={} windowHours={} losses={} traders={}",
                event.asset(), event.timeWindowHours(), totalLosses, totalAffected);
        return new ImpactReport(
                event,
                windowStart,
                now,
                totalAffected,
                totalLosses,
                Collections.unmodifiableMap(impact),
                concentration(retailPain, whalePain)
        );
    }

    static PainConcentration concentration(double retailPain, double whalePain) {
        double total = retailPain + whalePain;
        return new PainConcentration(
                total > 0 ? retailPain / total : 0.0,
                total > 0 ? whalePain / total : 0.0,
                whalePain > 0 ? retailPain / whalePain : Double.POSITIVE_INFINITY
        );
    }

    private static final class Accumulator {
        private int traders;
        private int lossCount;
        private double dollarLoss;
        private double painScore;

        private SegmentImpact toImpact() {
            return new SegmentImpact(
                    traders,
                    lossCount,
                    dollarLoss,
                    painScore,
                    dollarLoss > 0 ? painScore / dollarLoss : 0.0,
                    traders > 0 ? painScore / traders : 0.0
            );
        }
    }
}
