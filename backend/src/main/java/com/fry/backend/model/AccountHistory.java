package com.fry.backend.model;

import java.util.List;

/**
 * A profile snapshot together with its retained pain history, taken atomically.
 */
public record AccountHistory(AccountSnapshot account, List<PainHistoryEntry> entries) {}
