package com.fry.backend.controller;

import com.fry.backend.dto.BatchResult;
import com.fry.backend.dto.ImpactReport;
import com.fry.backend.dto.LeaderboardEntry;
import com.fry.backend.dto.LossAnalysis;
import com.fry.backend.dto.LossBatchRequest;
import com.fry.backend.dto.LossEventRequest;
import com.fry.backend.dto.NetworkMetrics;
import com.fry.backend.dto.PainReport;
import com.fry.backend.dto.TierClassification;
import com.fry.backend.dto.TraderPainProfile;
import com.fry.backend.dto.VolatilityEvent;
import com.fry.backend.model.LossEvent;
import com.fry.backend.model.TraderTier;
import com.fry.backend.service.LossIngestionService;
import com.fry.backend.service.PainAnalyticsService;
import com.fry.backend.service.TierClassifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

@RestController
@RequestMapping("/api/pain")
@RequiredArgsConstructor
@Tag(name = "Pain")
public class PainController {

    private final LossIngestionService ingestionService;
    private final PainAnalyticsService analyticsService;
    private final TierClassifier tierClassifier;

    @PostMapping("/losses")
    @Operation(summary = "Score and record a single loss")
    public LossAnalysis submitLoss(@Valid @RequestBody LossEventRequest request) {
        return ingestionService.processLoss(request.toEvent(Instant.now()));
    }

    @PostMapping("/losses/batch")
    @Operation(summary = "Score a batch of losses; invalid entries are reported, not fatal")
    public BatchResult submitBatch(@Valid @RequestBody LossBatchRequest request) {
        // untimestamped entries are stamped one nanosecond apart, in batch order
        Instant now = Instant.now();
        List<LossEventRequest> losses = request.events();
        List<LossEvent> events = IntStream.range(0, losses.size())
                .mapToObj(i -> losses.get(i) == null ? null : losses.get(i).toEvent(now.plusNanos(i)))
                .toList();
        return ingestionService.processBatch(events);
    }

    @GetMapping("/network")
    @Operation(summary = "Per-tier pain metrics and market insights")
    public NetworkMetrics network() {
        return analyticsService.getNetworkMetrics();
    }

    @GetMapping("/leaderboard")
    @Operation(summary = "Traders ranked by cumulative pain")
    public List<LeaderboardEntry> leaderboard(@RequestParam(required = false) Integer limit) {
        return analyticsService.getLeaderboard(limit);
    }

    @GetMapping("/impact")
    @Operation(summary = "Tier-segmented impact of losses in the trailing window")
    public ImpactReport impact(@RequestParam(required = false) String asset,
                               @RequestParam double windowHours,
                               @RequestParam(required = false) Double volatilitySpike,
                               @RequestParam(required = false) Double priceMove) {
        return analyticsService.getImpact(new VolatilityEvent(asset, windowHours, volatilitySpike, priceMove));
    }

    @GetMapping("/traders/{traderId}")
    @Operation(summary = "Pain profile of one trader")
    public TraderPainProfile trader(@PathVariable String traderId) {
        return analyticsService.getTraderProfile(traderId);
    }

    @GetMapping("/report")
    @Operation(summary = "Indices, network metrics and leaderboard in one document")
    public PainReport report() {
        return analyticsService.getPainReport();
    }

    @GetMapping("/tiers")
    @Operation(summary = "Classify an equity value into a trader tier")
    public TierClassification tier(@RequestParam double equity) {
        TraderTier tier = tierClassifier.classify(equity);
        return new TierClassification(equity, tier, tier.getDisplayName());
    }
}
