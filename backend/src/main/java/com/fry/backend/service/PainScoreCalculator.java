package com.fry.backend.service;

import com.fry.backend.config.PainEngineProperties;
import com.fry.backend.model.LossEvent;
import com.fry.backend.model.PainBreakdown;
import com.fry.backend.model.PainHistoryEntry;
import com.fry.backend.model.PainLevel;
import com.fry.backend.model.PainScore;
import com.fry.backend.model.TraderTier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Scores a single loss. The multiplier is the product of six factors:
 * leverage^exp x position risk x volatility x holding time x wealth adjustment x frequency,
 * clamped to the configured [min, max] range. Pure: the caller records the result.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PainScoreCalculator {

    private static final double HOURS_PER_DAY = 24.0;
    private static final double MAX_TIME_FACTOR = 3.0;

    private final PainEngineProperties properties;
    private final TierClassifier tierClassifier;
    private final LossEventValidator validator;

    /**
     * @param priorHistory the trader's history before this event; only entries inside the frequency
     *                     window and strictly before the event's timestamp are counted
     */
    public PainScore computePainScore(LossEvent event, List<PainHistoryEntry> priorHistory) {
        validator.validate(event);
        PainEngineProperties.Multiplier cfg = properties.getMultiplier();

        double positionRiskRatio = Math.min(event.positionSize() / event.accountEquity(), 1.0);
        double leveragePainFactor = Math.pow(event.leverage(), cfg.getLeverageExponent());
        double volatilityFactor = 1.0 + 2.0 * event.volatility();
        double timePainFactor = Math.min(1.0 + event.timeInPosition() / HOURS_PER_DAY, MAX_TIME_FACTOR);
        double wealthAdjustment = wealthAdjustment(event.accountEquity());
        int recentLosses = countRecentLosses(priorHistory, event.timestamp());
        double frequencyMultiplier = 1.0 + cfg.getFrequencyStep() * recentLosses;

        double rawMultiplier = leveragePainFactor
                * positionRiskRatio
                * volatilityFactor
                * timePainFactor
                * wealthAdjustment
                * frequencyMultiplier;
        double painMultiplier = Math.max(cfg.getMin(), Math.min(rawMultiplier, cfg.getMax()));
        double painWeightedScore = event.dollarLoss() * painMultiplier;

        PainLevel painLevel = PainLevel.fromMultiplier(painMultiplier);
        TraderTier tier = tierClassifier.classify(event.accountEquity());

        log.debug("Pain factors trader={} leverage={} positionRisk={} volatility={} time={} wealth={} frequency={} raw={}",
                event.traderId(), leveragePainFactor, positionRiskRatio, volatilityFactor, timePainFactor,
                wealthAdjustment, frequencyMultiplier, rawMultiplier);

        return new PainScore(
                event.traderId(),
                event.dollarLoss(),
                painWeightedScore,
                painMultiplier,
                painLevel,
                tier,
                new PainBreakdown(
                        leveragePainFactor,
                        positionRiskRatio,
                        volatilityFactor,
                        timePainFactor,
                        wealthAdjustment,
                        frequencyMultiplier
                ),
                event.timestamp()
        );
    }

    /**
     * Inverse of (equity / retailMax)^decay, floored so it never drops below the configured minimum.
     */
    double wealthAdjustment(double accountEquity) {
        PainEngineProperties.Multiplier cfg = properties.getMultiplier();
        double wealthDampener = Math.pow(accountEquity / properties.getTiers().getRetailMax(), cfg.getEquityDecayExponent());
        return Math.max(cfg.getWealthAdjustmentFloor(), 1.0 / wealthDampener);
    }

    int countRecentLosses(List<PainHistoryEntry> priorHistory, Instant eventTime) {
        if (priorHistory == null || priorHistory.isEmpty()) {
            return 0;
        }
        Instant windowStart = eventTime.minus(Duration.ofDays(properties.getMultiplier().getFrequencyWindowDays()));
        return (int) priorHistory.stream()
                .map(PainHistoryEntry::timestamp)
                .filter(ts -> ts.isAfter(windowStart) && ts.isBefore(eventTime))
                .count();
    }
}
