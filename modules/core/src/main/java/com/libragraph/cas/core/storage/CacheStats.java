package com.libragraph.cas.core.storage;

import java.util.Locale;

/**
 * Snapshot of a {@link TieredCacheStore}'s budget usage.
 */
public record CacheStats(long usedBytes, long byteBudget, int entries) {

    public double usedPercent() {
        return byteBudget == 0 ? 0 : usedBytes * 100.0 / byteBudget;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%d/%d (%.2f%%)", usedBytes, byteBudget, usedPercent());
    }
}
