package com.fry.backend.dto;

import com.fry.backend.model.LossEvent;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.time.Instant;

/**
 * Inbound loss. Missing {@code timestamp} means "now"; missing {@code timeInPosition} means zero hours.
 */
public record LossEventRequest(
        @NotBlank String traderId,
        String asset,
        @NotNull @Positive Double dollarLoss,
        @NotNull @Positive Double accountEquity,
        @NotNull @PositiveOrZero Double positionSize,
        @NotNull @DecimalMin("1.0") Double leverage,
        @NotNull @DecimalMin("0.0") @DecimalMax("1.0") Double volatility,
        @PositiveOrZero Double timeInPosition,
        Instant timestamp
) {

    /**
     * Missing numbers become NaN so that batch entries, which skip bean validation, are rejected by the engine.
     */
    public LossEvent toEvent(Instant now) {
        return LossEvent.builder()
                .traderId(traderId)
                .asset(asset)
                .dollarLoss(orNaN(dollarLoss))
                .accountEquity(orNaN(accountEquity))
                .positionSize(orNaN(positionSize))
                .leverage(orNaN(leverage))
                .volatility(orNaN(volatility))
                .timeInPosition(timeInPosition == null ? 0.0 : timeInPosition)
                .timestamp(timestamp == null ? now : timestamp)
                .build();
    }

    private static double orNaN(Double value) {
        return value == null ? Double.NaN : value;
    }
}
