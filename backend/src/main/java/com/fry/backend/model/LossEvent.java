package com.fry.backend.model;

import lombok.Builder;

import java.time.Instant;

/**
 * A realized trading loss as delivered by the exchange adapter. Amounts are in USD,
 * {@code timeInPosition} in hours and {@code volatility} normalized to [0, 1].
 */
@Builder(toBuilder = true)
public record LossEvent(
        String traderId,
        String asset,
        double dollarLoss,
        double accountEquity,
        double positionSize,
        double leverage,
        double volatility,
        double timeInPosition,
        Instant timestamp
) {}
