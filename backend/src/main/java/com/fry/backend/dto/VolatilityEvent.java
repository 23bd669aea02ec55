package com.fry.backend.dto;

/**
 * A market volatility episode to analyze. {@code volatilitySpike} and {@code priceMove} are descriptive only.
 */
public record VolatilityEvent(
        String asset,
        double timeWindowHours,
        Double volatilitySpike,
        Double priceMove
) {

    public static VolatilityEvent of(String asset, double timeWindowHours) {
        return new VolatilityEvent(asset, timeWindowHours, null, null);
    }
}
