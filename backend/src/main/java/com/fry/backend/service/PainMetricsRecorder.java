package com.fry.backend.service;

import com.fry.backend.event.LossScoredEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

@Component
@Slf4j
@RequiredArgsConstructor
public class PainMetricsRecorder {

    private final MeterRegistry meterRegistry;

    private final AtomicLong lossesScored = new AtomicLong();
    private final AtomicLong lossesRejected = new AtomicLong();

    @EventListener(LossScoredEvent.class)
    public void onLossScored(LossScoredEvent event) {
        lossesScored.incrementAndGet();
        Counter.builder("pain_losses_scored_total")
                .tag("tier", event.score().traderTier().name())
                .tag("level", event.score().painLevel().name())
                .register(meterRegistry)
                .increment();
        DistributionSummary.builder("pain_multiplier")
                .register(meterRegistry)
                .record(event.score().painMultiplier());
        DistributionSummary.builder("pain_weighted_score")
                .baseUnit("usd")
                .register(meterRegistry)
                .record(event.score().painWeightedScore());
    }

    public void recordRejection(String field) {
        lossesRejected.incrementAndGet();
        Counter.builder("pain_losses_rejected_total")
                .tag("field", field == null ? "unknown" : field)
                .register(meterRegistry)
                .increment();
    }

    public long getLossesScored() {
        return lossesScored.get();
    }

    public long getLossesRejected() {
        return lossesRejected.get();
    }
}
