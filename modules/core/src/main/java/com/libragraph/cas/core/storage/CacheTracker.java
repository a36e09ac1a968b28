package com.libragraph.cas.core.storage;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * LRU bookkeeping for a {@link TieredCacheStore}: cached key sizes ordered from least
 * to most recently used, plus the renames currently in flight.
 *
 * <p>Owned by exactly one store; all methods are synchronized on this instance.
 * Eviction is decided here, deleting the evicted content is left to the caller.
 */
final class CacheTracker {

    private final long byteBudget;
    // insertion order == recency order; touch() re-inserts
    private final LinkedHashMap<String, Long> entries = new LinkedHashMap<>();
    private final Map<String, String> pendingRenames = new HashMap<>();
    private long usedBytes;

    CacheTracker(long byteBudget) {
        if (byteBudget < 0) {
            throw new IllegalArgumentException("byteBudget must be >= 0, got: " + byteBudget);
        }
        this.byteBudget = byteBudget;
    }

    /**
     * Registers or refreshes {@code key} as most recently used.
     *
     * @return keys whose cached content must now be deleted
     */
    synchronized List<String> record(String key, long size) {
        removeEntry(key);
        if (size > byteBudget) {
            // can never fit: evict it alone
            return skipIfMoved(List.of(key));
        }
        entries.put(key, size);
        usedBytes += size;

        List<String> evicted = new ArrayList<>();
        Iterator<Map.Entry<String, Long>> oldest = entries.entrySet().iterator();
        while (usedBytes > byteBudget && oldest.hasNext()) {
            Map.Entry<String, Long> entry = oldest.next();
            oldest.remove();
            usedBytes -= entry.getValue();
            evicted.add(entry.getKey());
        }
        return skipIfMoved(evicted);
    }

    /**
     * Marks {@code key} as most recently used.
     *
     * @return whether the key is tracked
     */
    synchronized boolean touch(String key) {
        Long size = entries.remove(key);
        if (size == null) {
            return false;
        }
        entries.put(key, size);
        return true;
    }

    /**
     * Tracked size of {@code key} without affecting recency, or null.
     */
    synchronized Long size(String key) {
        return entries.get(key);
    }

    synchronized Long remove(String key) {
        return removeEntry(key);
    }

    synchronized void beginRename(String sourceKey, String destKey) {
        pendingRenames.put(sourceKey, destKey);
    }

    synchronized void endRename(String sourceKey) {
        pendingRenames.remove(sourceKey);
    }

    synchronized boolean isRenaming(String key) {
        return pendingRenames.containsKey(key);
    }

    synchronized CacheStats stats() {
        return new CacheStats(usedBytes, byteBudget, entries.size());
    }

    long byteBudget() {
        return byteBudget;
    }

    private Long removeEntry(String key) {
        Long previous = entries.remove(key);
        if (previous != null) {
            usedBytes -= previous;
        }
        return previous;
    }

    // Content of a key being renamed has moved, not gone: consume the marker instead of deleting.
    private List<String> skipIfMoved(List<String> evicted) {
        List<String> toDelete = new ArrayList<>(evicted.size());
        for (String key : evicted) {
            if (pendingRenames.remove(key) == null) {
                toDelete.add(key);
            }
        }
        return toDelete;
    }
}
