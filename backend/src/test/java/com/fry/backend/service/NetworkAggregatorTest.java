package com.fry.backend.service;

import com.fry.backend.config.PainEngineProperties;
import com.fry.backend.dto.NetworkMetrics;
import com.fry.backend.model.AccountSnapshot;
import com.fry.backend.model.TraderTier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fry.backend.util.TestLossFactory.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.data.Offset.offset;

class NetworkAggregatorTest {

    private final NetworkAggregator aggregator = new NetworkAggregator(new TierClassifier(new PainEngineProperties()));

    @Test
    void emptyNetworkHasZeroConcentrationAndAllTiers() {
        NetworkMetrics metrics = aggregator.aggregate(List.of());

        assertThat(metrics.painConcentration()).isZero();
        assertThat(metrics.segments()).containsOnlyKeys(TraderTier.values());
        assertThat(metrics.segment(TraderTier.FISH).traderCount()).isZero();
        assertThat(metrics.insights()).isEmpty();
    }

    @Test
    void groupsByMaxEquityAndComputesSegmentStatistics() {
        NetworkMetrics metrics = aggregator.aggregate(List.of(
                snapshot("s1", 1, 2_000, 1_000, 20_000),
                snapshot("s2", 2, 4_000, 500, 5_000),
                snapshot("r1", 3, 30_000, 2_000, 10_000),
                snapshot("w1", 4, 3_000_000, 100_000, 10_000)
        ));

        assertThat(metrics.totalTraders()).isEqualTo(4);
        assertThat(metrics.segment(TraderTier.SHRIMP).traderCount()).isEqualTo(2);
        assertThat(metrics.segment(TraderTier.SHRIMP).totalPainScore()).isCloseTo(25_000, offset(1e-9));
        assertThat(metrics.segment(TraderTier.SHRIMP).avgPainMultiplier()).isCloseTo((20.0 + 10.0) / 2, offset(1e-9));
        assertThat(metrics.segment(TraderTier.SHRIMP).painEfficiency()).isCloseTo(25_000 / 1_500.0, offset(1e-9));
        assertThat(metrics.segment(TraderTier.SHRIMP).avgEquity()).isCloseTo(3_000, offset(1e-9));
        assertThat(metrics.segment(TraderTier.SHRIMP).painShare()).isCloseTo(25_000 / 45_000.0, offset(1e-9));
        assertThat(metrics.painConcentration()).isCloseTo(35_000 / 45_000.0, offset(1e-9));
    }

    @Test
    void concentrationStaysWithinUnitInterval() {
        assertThat(NetworkAggregator.painConcentration(0, 0)).isZero();
        assertThat(NetworkAggregator.painConcentration(10, 0)).isEqualTo(1.0);
        assertThat(NetworkAggregator.painConcentration(0, 10)).isZero();
        for (double retail = 0; retail < 100; retail += 7.3) {
            for (double whale = 0.5; whale < 100; whale += 9.1) {
                assertThat(NetworkAggregator.painConcentration(retail, whale)).isBetween(0.0, 1.0);
            }
        }
    }

    @Test
    void retailOnlyPainTriggersCapitulationInsights() {
        NetworkMetrics metrics = aggregator.aggregate(List.of(snapshot("s1", 1, 2_000, 1_000, 50_000)));

        assertThat(metrics.painConcentration()).isEqualTo(1.0);
        assertThat(metrics.insights()).containsExactly(
                "Retail traders suffering disproportionately - potential bottom signal",
                "Extreme pain concentration in retail - capitulation phase");
    }

    @Test
    void painfulWhalesAreFlagged() {
        NetworkMetrics metrics = aggregator.aggregate(List.of(snapshot("w1", 1, 5_000_000, 10_000, 150_000)));

        assertThat(metrics.insights()).containsExactly("Whales experiencing significant pain - major market move likely");
    }

    static AccountSnapshot snapshot(String traderId, long sequence, double maxEquity, double dollarLoss, double pain) {
        return new AccountSnapshot(traderId, sequence, T0, dollarLoss, pain, 1, maxEquity, maxEquity,
                2.0, pain / dollarLoss, List.of());
    }
}
