package com.fry.backend.dto;

import java.time.Instant;
import java.util.List;

public record PainReport(
        Instant generatedAt,
        PainIndices painIndices,
        NetworkMetrics networkMetrics,
        List<LeaderboardEntry> leaderboard
) {}
