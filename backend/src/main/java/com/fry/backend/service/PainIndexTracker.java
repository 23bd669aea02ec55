package com.fry.backend.service;

import com.fry.backend.dto.PainIndices;
import com.fry.backend.model.LossEvent;
import com.fry.backend.model.PainScore;
import com.fry.backend.model.TraderTier;
import org.springframework.stereotype.Component;

/**
 * Exponentially smoothed pain indices. Each loss contributes with weight {@code dollarLoss / 1000};
 * the smoothing factor grows with the weight and is capped at 0.1.
 */
@Component
public class PainIndexTracker {

    private static final double WEIGHT_UNIT = 1000.0;
    private static final double ALPHA_DIVISOR = 100.0;
    private static final double MAX_ALPHA = 0.1;

    private double retailPainIndex;
    private double whalePainIndex;
    private double leveragePainIndex;
    private double painConcentration;

    public synchronized PainIndices update(LossEvent event, PainScore score, double networkPainConcentration) {
        double weight = score.dollarLoss() / WEIGHT_UNIT;
        if (score.traderTier().isRetailSide()) {
            retailPainIndex = smooth(retailPainIndex, score.painMultiplier(), weight);
        }
        if (score.traderTier() == TraderTier.WHALE) {
            whalePainIndex = smooth(whalePainIndex, score.painMultiplier(), weight);
        }
        if (event.leverage() > 1) {
            leveragePainIndex = smooth(leveragePainIndex, score.breakdown().leverageFactor(), weight);
        }
        painConcentration = networkPainConcentration;
        return current();
    }

    public synchronized PainIndices current() {
        return new PainIndices(retailPainIndex, whalePainIndex, leveragePainIndex, painConcentration);
    }

    static double smooth(double current, double value, double weight) {
        double alpha = Math.min(weight / ALPHA_DIVISOR, MAX_ALPHA);
        return current * (1 - alpha) + value * alpha;
    }
}
