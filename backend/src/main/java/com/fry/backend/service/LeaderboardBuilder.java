package com.fry.backend.service;

import com.fry.backend.dto.LeaderboardEntry;
import com.fry.backend.exception.PainValidationException;
import com.fry.backend.model.AccountSnapshot;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

@Service
@RequiredArgsConstructor
public class LeaderboardBuilder {

    /**
     * Highest cumulative pain first; equal pain keeps first-seen order.
     */
    static final Comparator<AccountSnapshot> PAIN_ORDER = Comparator
            .comparingDouble(AccountSnapshot::totalPainScore).reversed()
            .thenComparingLong(AccountSnapshot::sequence);

    private final TierClassifier tierClassifier;

    public List<LeaderboardEntry> topN(Collection<AccountSnapshot> profiles, int n) {
        if (n < 0) {
            throw new PainValidationException("limit", "must not be negative");
        }
        List<AccountSnapshot> ranked = rank(profiles);
        List<LeaderboardEntry> entries = new ArrayList<>(Math.min(n, ranked.size()));
        for (int i = 0; i < ranked.size() && i < n; i++) {
            AccountSnapshot profile = ranked.get(i);
            entries.add(new LeaderboardEntry(
                    i + 1,
                    profile.traderId(),
                    tierClassifier.classify(profile.maxEquitySeen()),
                    profile.totalDollarLosses(),
                    profile.totalPainScore(),
                    profile.avgPainMultiplier(),
                    profile.lossCount(),
                    profile.maxEquitySeen(),
                    profile.avgLeverage(),
                    profile.maxPainMultiplier()
            ));
        }
        return entries;
    }

    public List<AccountSnapshot> rank(Collection<AccountSnapshot> profiles) {
        return profiles.stream()
                .sorted(PAIN_ORDER)
                .toList();
    }
}
