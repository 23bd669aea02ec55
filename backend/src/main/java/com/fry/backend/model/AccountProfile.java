package com.fry.backend.model;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Cumulative loss state of one trader. Created on the trader's first loss and mutated in place by
 * every later one. All access goes through the intrinsic lock so that a snapshot never observes a
 * half-applied update.
 */
public class AccountProfile {

    private final String traderId;
    private final long sequence;
    private final Instant firstSeen;
    private final int recentCapacity;
    private final Deque<LossEvent> recentHistory = new ArrayDeque<>();
    private final PainHistoryLog painHistory;

    private double totalDollarLosses;
    private double totalPainScore;
    private int lossCount;
    private double maxEquitySeen;
    private double minEquitySeen;
    private double avgLeverage;
    private double maxPainMultiplier;

    public AccountProfile(String traderId, long sequence, Instant firstSeen, double initialEquity,
                          int recentCapacity, Duration retention, Duration frequencyWindow,
                          int maxHistoryEntries) {
        this.traderId = traderId;
        this.sequence = sequence;
        this.firstSeen = firstSeen;
        this.recentCapacity = recentCapacity;
        this.painHistory = new PainHistoryLog(retention, frequencyWindow, maxHistoryEntries);
        this.maxEquitySeen = initialEquity;
        this.minEquitySeen = initialEquity;
    }

    public String getTraderId() {
        return traderId;
    }

    public synchronized void apply(LossEvent event, PainScore score) {
        maxEquitySeen = Math.max(maxEquitySeen, event.accountEquity());
        minEquitySeen = Math.min(minEquitySeen, event.accountEquity());

        totalDollarLosses += score.dollarLoss();
        totalPainScore += score.painWeightedScore();
        lossCount++;
        maxPainMultiplier = Math.max(maxPainMultiplier, score.painMultiplier());
        avgLeverage = avgLeverage * (lossCount - 1) / lossCount + event.leverage() / lossCount;

        recentHistory.addLast(event);
        while (recentHistory.size() > recentCapacity) {
            recentHistory.removeFirst();
        }
        painHistory.append(PainHistoryEntry.of(score));
    }

    public synchronized List<PainHistoryEntry> historyBetween(Instant from, Instant to) {
        return painHistory.between(from, to);
    }

    public synchronized AccountSnapshot snapshot() {
        return new AccountSnapshot(
                traderId,
                sequence,
                firstSeen,
                totalDollarLosses,
                totalPainScore,
                lossCount,
                maxEquitySeen,
                minEquitySeen,
                avgLeverage,
                maxPainMultiplier,
                List.copyOf(recentHistory)
        );
    }

    public synchronized AccountHistory history() {
        return new AccountHistory(snapshot(), painHistory.entries());
    }
}
