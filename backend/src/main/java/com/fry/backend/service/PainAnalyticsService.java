package com.fry.backend.service;

import com.fry.backend.config.PainEngineProperties;
import com.fry.backend.dto.ImpactReport;
import com.fry.backend.dto.LeaderboardEntry;
import com.fry.backend.dto.NetworkMetrics;
import com.fry.backend.dto.PainReport;
import com.fry.backend.dto.TraderPainProfile;
import com.fry.backend.dto.TraderPainProfile.EquityRange;
import com.fry.backend.dto.TraderPainProfile.PainRank;
import com.fry.backend.dto.TraderPainProfile.RecentActivity;
import com.fry.backend.dto.VolatilityEvent;
import com.fry.backend.exception.TraderNotFoundException;
import com.fry.backend.model.AccountHistory;
import com.fry.backend.model.AccountSnapshot;
import com.fry.backend.model.PainHistoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Read side of the engine. Every query works on fresh snapshots of the profile store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PainAnalyticsService {

    private final PainEngineProperties properties;
    private final AccountProfileStore store;
    private final TierClassifier tierClassifier;
    private final NetworkAggregator aggregator;
    private final VolatilityEventAnalyzer volatilityAnalyzer;
    private final LeaderboardBuilder leaderboardBuilder;
    private final PainIndexTracker indexTracker;

    public NetworkMetrics getNetworkMetrics() {
        return aggregator.aggregate(store.snapshots());
    }

    /**
     * @param limit number of entries; {@code null} means the configured default
     */
    public List<LeaderboardEntry> getLeaderboard(Integer limit) {
        int n = limit != null ? limit : properties.getAnalytics().getDefaultLeaderboardSize();
        return leaderboardBuilder.topN(store.snapshots(), n);
    }

    public ImpactReport getImpact(VolatilityEvent event) {
        return getImpact(event, Instant.now());
    }

    public ImpactReport getImpact(VolatilityEvent event, Instant now) {
        return volatilityAnalyzer.analyzeImpact(event, store.histories(), now);
    }

    public TraderPainProfile getTraderProfile(String traderId) {
        return getTraderProfile(traderId, Instant.now());
    }

    public TraderPainProfile getTraderProfile(String traderId, Instant now) {
        AccountHistory history = store.findHistory(traderId)
                .orElseThrow(() -> new TraderNotFoundException(traderId));
        AccountSnapshot account = history.account();

        int windowDays = properties.getAnalytics().getActivityWindowDays();
        Instant windowStart = now.minus(Duration.ofDays(windowDays));
        List<PainHistoryEntry> recent = history.entries().stream()
                .filter(entry -> !entry.timestamp().isBefore(windowStart) && !entry.timestamp().isAfter(now))
                .toList();

        return new TraderPainProfile(
                account.traderId(),
                tierClassifier.classify(account.maxEquitySeen()),
                account.totalDollarLosses(),
                account.totalPainScore(),
                account.lossCount(),
                account.avgPainMultiplier(),
                new EquityRange(account.minEquitySeen(), account.maxEquitySeen()),
                account.avgLeverage(),
                account.maxPainMultiplier(),
                account.firstSeen(),
                new RecentActivity(
                        windowDays,
                        recent.size(),
                        recent.stream().mapToDouble(PainHistoryEntry::painWeightedScore).sum()),
                painRank(traderId),
                account.recentHistory()
        );
    }

    public PainReport getPainReport() {
        List<AccountSnapshot> snapshots = store.snapshots();
        PainReport report = new PainReport(
                Instant.now(),
                indexTracker.current(),
                aggregator.aggregate(snapshots),
                leaderboardBuilder.topN(snapshots, properties.getAnalytics().getReportLeaderboardSize())
        );
        log.debug("Pain report generated traders={}", snapshots.size());
        return report;
    }

    private PainRank painRank(String traderId) {
        List<AccountSnapshot> ranked = leaderboardBuilder.rank(store.snapshots());
        int totalTraders = ranked.size();
        for (int i = 0; i < totalTraders; i++) {
            if (ranked.get(i).traderId().equals(traderId)) {
                int rank = i + 1;
                return new PainRank(rank, totalTraders, (totalTraders - rank) * 100.0 / totalTraders);
            }
        }
        throw new TraderNotFoundException(traderId);
    }
}
