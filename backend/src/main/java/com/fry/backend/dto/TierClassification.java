package com.fry.backend.dto;

import com.fry.backend.model.TraderTier;

public record TierClassification(double equity, TraderTier tier, String displayName) {}
