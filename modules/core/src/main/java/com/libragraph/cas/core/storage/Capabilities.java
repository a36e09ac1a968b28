package com.libragraph.cas.core.storage;

import io.smallrye.mutiny.Uni;

/**
 * Well-known capability names and typed helpers around {@link Store#invoke}.
 */
public final class Capabilities {

    /** {@code copy(String sourceKey, String destKey)}: duplicates an entry, overwriting dest. */
    public static final String COPY = "copy";

    /** {@code stats()}: returns {@link CacheStats}; offered by {@link TieredCacheStore}. */
    public static final String STATS = "stats";

    private Capabilities() {
    }

    public static Uni<Void> copy(Store store, String sourceKey, String destKey) {
        return store.invoke(COPY, sourceKey, destKey).replaceWithVoid();
    }

    public static Uni<CacheStats> stats(Store store) {
        return store.invoke(STATS).onItem().castTo(CacheStats.class);
    }

    /**
     * Reads a required String argument of a capability call.
     *
     * @throws IllegalArgumentException if missing or not a String
     */
    public static String stringArg(String capability, Object[] args, int index) {
        if (args == null || args.length <= index || !(args[index] instanceof String value)) {
            throw new IllegalArgumentException(
                    capability + " expects a String argument at position " + index);
        }
        return value;
    }
}
