package com.fry.backend.model;

/**
 * Wealth tiers in ascending order of observed account equity.
 */
public enum TraderTier {
    SHRIMP("Shrimp"),
    RETAIL("Retail"),
    FISH("Fish"),
    WHALE("Whale");

    private final String displayName;

    TraderTier(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Shrimp and Retail together form the retail side of the pain concentration ratio.
     */
    public boolean isRetailSide() {
        return this == SHRIMP || this == RETAIL;
    }
}
