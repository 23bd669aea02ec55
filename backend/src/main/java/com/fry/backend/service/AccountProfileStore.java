package com.fry.backend.service;

import com.fry.backend.config.PainEngineProperties;
import com.fry.backend.exception.TraderNotFoundException;
import com.fry.backend.model.AccountHistory;
import com.fry.backend.model.AccountProfile;
import com.fry.backend.model.AccountSnapshot;
import com.fry.backend.model.LossEvent;
import com.fry.backend.model.PainHistoryEntry;
import com.fry.backend.model.PainScore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns every trader's {@link AccountProfile}. Profiles are created on the first recorded loss only;
 * reads never create one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AccountProfileStore {

    private final PainEngineProperties properties;

    private final Map<String, AccountProfile> profiles = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public void recordLoss(LossEvent event, PainScore score) {
        AccountProfile profile = profiles.computeIfAbsent(event.traderId(), traderId -> {
            PainEngineProperties.History history = properties.getHistory();
            log.info("New trader profile {} (equity {})", traderId, event.accountEquity());
            return new AccountProfile(
                    traderId,
                    sequence.incrementAndGet(),
                    event.timestamp(),
                    event.accountEquity(),
                    history.getRecentCapacity(),
                    Duration.ofDays(history.getRetentionDays()),
                    Duration.ofDays(properties.getMultiplier().getFrequencyWindowDays()),
                    history.getMaxEntries()
            );
        });
        profile.apply(event, score);
    }

    public Optional<AccountSnapshot> findProfile(String traderId) {
        if (traderId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(traderId)).map(AccountProfile::snapshot);
    }

    public AccountSnapshot getProfile(String traderId) {
        return findProfile(traderId).orElseThrow(() -> new TraderNotFoundException(traderId));
    }

    /**
     * Losses recorded for the trader in the {@code windowDays} before {@code asOf}, exclusive at both ends.
     * Called before the loss being scored is recorded, so it never contains that loss.
     */
    public List<PainHistoryEntry> getRecentEvents(String traderId, int windowDays, Instant asOf) {
        AccountProfile profile = traderId == null ? null : profiles.get(traderId);
        if (profile == null) {
            return List.of();
        }
        return profile.historyBetween(asOf.minus(Duration.ofDays(windowDays)), asOf);
    }

    /**
     * Snapshots of every profile in first-seen order.
     */
    public List<AccountSnapshot> snapshots() {
        return profiles.values().stream()
                .map(AccountProfile::snapshot)
                .sorted(Comparator.comparingLong(AccountSnapshot::sequence))
                .toList();
    }

    public Optional<AccountHistory> findHistory(String traderId) {
        if (traderId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(traderId)).map(AccountProfile::history);
    }

    /**
     * Every profile with its retained pain history, in first-seen order.
     */
    public List<AccountHistory> histories() {
        return profiles.values().stream()
                .map(AccountProfile::history)
                .sorted(Comparator.comparingLong(history -> history.account().sequence()))
                .toList();
    }

    public int size() {
        return profiles.size();
    }
}
