package com.fry.backend.model;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Per-account log of scored losses used for the frequency factor and for event-window analysis.
 * Entries are kept in arrival order and bounded two ways: anything older than the retention horizon
 * (measured from the newest timestamp seen) is dropped, and the log never exceeds {@code maxEntries}.
 * When the entry cap evicts a loss that still falls inside the frequency window, later frequency
 * factors undercount; each such eviction is logged and counted.
 * Not thread-safe; the owning {@link AccountProfile} guards access.
 */
@Slf4j
public class PainHistoryLog {

    private final Duration retention;
    private final Duration frequencyWindow;
    private final int maxEntries;
    private final Deque<PainHistoryEntry> entries = new ArrayDeque<>();
    private Instant newest;
    private long windowEvictions;

    public PainHistoryLog(Duration retention, Duration frequencyWindow, int maxEntries) {
        if (retention.isNegative() || retention.isZero()) {
            throw new IllegalArgumentException("retention must be positive");
        }
        if (frequencyWindow.isNegative() || frequencyWindow.isZero()) {
            throw new IllegalArgumentException("frequencyWindow must be positive");
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1");
        }
        this.retention = retention;
        this.frequencyWindow = frequencyWindow;
        this.maxEntries = maxEntries;
    }

    public void append(PainHistoryEntry entry) {
        entries.addLast(entry);
        if (newest == null || entry.timestamp().isAfter(newest)) {
            newest = entry.timestamp();
        }
        prune();
    }

    /**
     * Entries with {@code from < timestamp < to}.
     */
    public List<PainHistoryEntry> between(Instant from, Instant to) {
        return entries.stream()
                .filter(entry -> entry.timestamp().isAfter(from) && entry.timestamp().isBefore(to))
                .toList();
    }

    public List<PainHistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Number of entries the cap has evicted while they were still inside the frequency window.
     */
    public long windowEvictions() {
        return windowEvictions;
    }

    private void prune() {
        Instant horizon = newest.minus(retention);
        entries.removeIf(entry -> entry.timestamp().isBefore(horizon));
        Instant windowStart = newest.minus(frequencyWindow);
        while (entries.size() > maxEntries) {
            PainHistoryEntry evicted = entries.removeFirst();
            if (evicted.timestamp().isAfter(windowStart)) {
                windowEvictions++;
                log.warn("History cap of {} evicted a loss at {} inside the {} frequency window; "
                        + "raise pain.history.max-entries", maxEntries, evicted.timestamp(), frequencyWindow);
            }
        }
    }
}
