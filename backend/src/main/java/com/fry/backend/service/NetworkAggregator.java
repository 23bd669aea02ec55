package com.fry.backend.service;

import com.fry.backend.dto.NetworkMetrics;
import com.fry.backend.dto.SegmentMetrics;
import com.fry.backend.model.AccountSnapshot;
import com.fry.backend.model.TraderTier;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class NetworkAggregator {

    static final double DISPROPORTIONATE_RETAIL_RATIO = 5.0;
    static final double WHALE_PAIN_ALERT = 10.0;
    static final double EXTREME_CONCENTRATION = 0.9;

    private final TierClassifier tierClassifier;

    public NetworkMetrics aggregate(Collection<AccountSnapshot> profiles) {
        Map<TraderTier, List<AccountSnapshot>> byTier = new EnumMap<>(TraderTier.class);
        for (TraderTier tier : TraderTier.values()) {
            byTier.put(tier, new ArrayList<>());
        }
        for (AccountSnapshot profile : profiles) {
            byTier.get(tierClassifier.classify(profile.maxEquitySeen())).add(profile);
        }

        double networkPain = profiles.stream().mapToDouble(AccountSnapshot::totalPainScore).sum();
        double networkLosses = profiles.stream().mapToDouble(AccountSnapshot::totalDollarLosses).sum();

        Map<TraderTier, SegmentMetrics> segments = new EnumMap<>(TraderTier.class);
        byTier.forEach((tier, members) -> segments.put(tier, segment(members, networkPain)));

        double retailPain = segments.get(TraderTier.SHRIMP).totalPainScore() + segments.get(TraderTier.RETAIL).totalPainScore();
        double whalePain = segments.get(TraderTier.WHALE).totalPainScore();
        double concentration = painConcentration(retailPain, whalePain);

        return new NetworkMetrics(
                Collections.unmodifiableMap(segments),
                profiles.size(),
                networkLosses,
                networkPain,
                concentration,
                marketInsights(segments, concentration)
        );
    }

    /**
     * Retail share of retail plus whale pain; 0 when neither side has any.
     */
    public static double painConcentration(double retailPain, double whalePain) {
        double total = retailPain + whalePain;
        return total > 0 ? retailPain / total : 0.0;
    }

    private SegmentMetrics segment(List<AccountSnapshot> members, double networkPain) {
        double totalDollarLosses = members.stream().mapToDouble(AccountSnapshot::totalDollarLosses).sum();
        double totalPainScore = members.stream().mapToDouble(AccountSnapshot::totalPainScore).sum();
        double avgPainMultiplier = members.stream().mapToDouble(AccountSnapshot::avgPainMultiplier).average().orElse(0.0);
        double avgEquity = members.stream().mapToDouble(AccountSnapshot::maxEquitySeen).average().orElse(0.0);
        return new SegmentMetrics(
                members.size(),
                totalDollarLosses,
                totalPainScore,
                avgPainMultiplier,
                totalDollarLosses > 0 ? totalPainScore / totalDollarLosses : 0.0,
                avgEquity,
                networkPain > 0 ? totalPainScore / networkPain : 0.0
        );
    }

    private List<String> marketInsights(Map<TraderTier, SegmentMetrics> segments, double concentration) {
        List<String> insights = new ArrayList<>();
        double retailAvg = segments.get(TraderTier.SHRIMP).avgPainMultiplier() + segments.get(TraderTier.RETAIL).avgPainMultiplier();
        double whaleAvg = segments.get(TraderTier.WHALE).avgPainMultiplier();
        if (retailAvg > whaleAvg * DISPROPORTIONATE_RETAIL_RATIO) {
            insights.add("Retail traders suffering disproportionately - potential bottom signal");
        }
        if (whaleAvg > WHALE_PAIN_ALERT) {
            insights.add("Whales experiencing significant pain - major market move likely");
        }
        if (concentration > EXTREME_CONCENTRATION) {
            insights.add("Extreme pain concentration in retail - capitulation phase");
        }
        return List.copyOf(insights);
    }
}
