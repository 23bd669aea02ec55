package com.fry.backend.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "pain")
@Data
@Validated
public class PainEngineProperties {

    @Valid
    private Tiers tiers = new Tiers();
    @Valid
    private Multiplier multiplier = new Multiplier();
    @Valid
    private History history = new History();
    @Valid
    private Analytics analytics = new Analytics();
    @Valid
    private Ingestion ingestion = new Ingestion();

    @AssertTrue(message = "retention-days must cover the frequency and activity windows")
    public boolean isRetentionCoveringWindows() {
        return history.getRetentionDays() >= multiplier.getFrequencyWindowDays()
                && history.getRetentionDays() >= analytics.getActivityWindowDays();
    }

    @Data
    public static class Tiers {
        @PositiveOrZero
        private double shrimpMax = 5_000;

        @Positive
        private double retailMax = 50_000;

        @Positive
        private double whaleMin = 1_000_000;

        @AssertTrue(message = "tier thresholds must satisfy shrimpMax < retailMax < whaleMin")
        public boolean isOrdered() {
            return shrimpMax < retailMax && retailMax < whaleMin;
        }
    }

    @Data
    public static class Multiplier {
        @DecimalMin(value = "0.0", inclusive = false)
        private double min = 0.01;

        @Positive
        private double max = 1000.0;

        @Positive
        private double leverageExponent = 1.5;

        @Positive
        private double equityDecayExponent = 0.7;

        @Positive
        private double wealthAdjustmentFloor = 0.1;

        @PositiveOrZero
        private double frequencyStep = 0.2;

        @Min(1)
        private int frequencyWindowDays = 7;

        @AssertTrue(message = "multiplier.min must be below multiplier.max")
        public boolean isRangeValid() {
            return min < max;
        }
    }

    @Data
    public static class History {
        @Min(1)
        private int recentCapacity = 50;

        @Min(1)
        private int retentionDays = 30;

        @Min(1)
        private int maxEntries = 10_000;
    }

    @Data
    public static class Analytics {
        @Min(1)
        private int activityWindowDays = 30;

        @Min(1)
        private int reportLeaderboardSize = 20;

        @Min(1)
        private int defaultLeaderboardSize = 10;
    }

    @Data
    public static class Ingestion {
        @Min(1)
        private int maxBatchSize = 1000;
    }
}
