package com.fry.backend.event;

import com.fry.backend.model.PainScore;

import java.time.Instant;

/**
 * Published once per accepted loss. Reward layers consume {@code score.painMultiplier()}.
 */
public record LossScoredEvent(
        String traderId,
        String asset,
        PainScore score,
        Instant occurredAt
) {
}
