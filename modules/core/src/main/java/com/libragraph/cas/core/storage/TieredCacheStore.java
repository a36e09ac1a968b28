package com.libragraph.cas.core.storage;

import com.libragraph.cas.core.stream.StreamTee;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.subscription.Cancellable;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Store that keeps recently used blobs in a fast cache tier in front of a durable
 * fallback tier.
 *
 * <ul>
 *   <li>The fallback tier holds every blob and is the source of truth for {@link #exists}.</li>
 *   <li>The cache tier holds a subset whose total size stays within {@code byteBudget};
 *       least recently used blobs are evicted from the cache tier only.</li>
 *   <li>Writes go to both tiers at once; reads that miss the cache stream from the
 *       fallback and populate the cache on the way through.</li>
 * </ul>
 *
 * <p>Extension capabilities of both tiers are forwarded (see {@link #capabilities()}).
 *
 * <p>When one tier fails and the other succeeds, the operation fails and the
 * succeeding tier is not rolled back. A cache tier left out of date is repaired by
 * the next read-through, since cache misses always fall back.
 */
public class TieredCacheStore implements Store {

    private static final Logger log = Logger.getLogger(TieredCacheStore.class);

    public static final long DEFAULT_BYTE_BUDGET = 100L * 1024 * 1024; // 100 MiB

    private final Store cacheTier;
    private final Store fallbackTier;
    private final CacheTracker tracker;
    private final Map<String, StoreCapability> capabilities;

    public TieredCacheStore(Store cacheTier, Store fallbackTier) {
        this(cacheTier, fallbackTier, DEFAULT_BYTE_BUDGET);
    }

    public TieredCacheStore(Store cacheTier, Store fallbackTier, long byteBudget) {
        this.cacheTier = Objects.requireNonNull(cacheTier, "cacheTier cannot be null");
        this.fallbackTier = Objects.requireNonNull(fallbackTier, "fallbackTier cannot be null");
        this.tracker = new CacheTracker(byteBudget);
        this.capabilities = composeCapabilities();
    }

    public Store cacheTier() {
        return cacheTier;
    }

    public Store fallbackTier() {
        return fallbackTier;
    }

    public CacheStats stats() {
        return tracker.stats();
    }

    /**
     * Whether {@code key} is currently budgeted in the cache tier.
     */
    public boolean isCached(String key) {
        return tracker.size(key) != null;
    }

    @Override
    public Uni<Void> write(String key, Multi<byte[]> source) {
        return Uni.createFrom().deferred(() -> {
            log.debugf("Writing %s to cache and fallback", key);
            AtomicLong size = new AtomicLong();
            Multi<byte[]> shared = StreamTee.split(source.onItem().invoke(chunk -> size.addAndGet(chunk.length)), 2);
            return StreamTee.both(
                            fallbackTier.write(key, shared).replaceWith(Boolean.TRUE),
                            cacheTier.write(key, shared).replaceWith(Boolean.TRUE))
                    .onFailure().invoke(e -> log.debugf("Write of %s failed: %s", key, e.getMessage()))
                    .onItem().transformToUni(ignored -> register(key, size.get()));
        });
    }

    @Override
    public Multi<byte[]> read(String key) {
        return Multi.createFrom().deferred(() -> {
            if (tracker.touch(key)) {
                log.debugf("Cache hit for %s, streaming from cache tier", key);
                return cacheTier.read(key)
                        .onFailure(BlobNotFoundException.class).recoverWithMulti(() -> {
                            log.debugf("Cache tier lost %s, falling back", key);
                            tracker.remove(key);
                            return readThrough(key);
                        });
            }
            log.debugf("Cache miss for %s, streaming from fallback tier", key);
            return readThrough(key);
        });
    }

    private Multi<byte[]> readThrough(String key) {
        AtomicLong size = new AtomicLong();
        AtomicBoolean attached = new AtomicBoolean();
        Multi<byte[]> shared = StreamTee.split(fallbackTier.read(key), 2);
        Multi<byte[]> toCache = shared
                .onSubscription().invoke(subscription -> attached.set(true))
                .onItem().invoke(chunk -> size.addAndGet(chunk.length));
        Uni<Void> population = cacheTier.write(key, toCache)
                .onItem().transformToUni(ignored -> register(key, size.get()))
                .onFailure().invoke(e -> log.debugf("Not caching %s: %s", key, e.getMessage()))
                .onFailure().recoverWithNull()
                .memoize().indefinitely();
        // subscribes the cache tier first; the caller's subscription connects the source
        Cancellable populating = population.subscribe().with(ignored -> { });
        if (!attached.get()) {
            // the cache tier gave up before consuming anything
            populating.cancel();
            return fallbackTier.read(key);
        }
        return shared.onCompletion().call(() -> population);
    }

    @Override
    public Uni<Void> rename(String sourceKey, String destKey) {
        return Uni.createFrom().deferred(() -> {
            Long size = tracker.size(sourceKey);
            tracker.beginRename(sourceKey, destKey);

            // eviction may already have dropped the cached copy
            Uni<Boolean> cacheMove = cacheTier.exists(sourceKey)
                    .onItem().transformToUni(present -> present
                            ? cacheTier.rename(sourceKey, destKey).replaceWith(Boolean.TRUE)
                                    .onFailure(BlobNotFoundException.class).recoverWithItem(Boolean.FALSE)
                            : Uni.createFrom().item(Boolean.FALSE));

            return StreamTee.both(fallbackTier.rename(sourceKey, destKey).replaceWith(Boolean.TRUE), cacheMove)
                    .onItem().transformToUni(moved -> afterRename(sourceKey, destKey, size, moved.getItem2()))
                    .onTermination().invoke(() -> tracker.endRename(sourceKey));
        });
    }

    private Uni<Void> afterRename(String sourceKey, String destKey, Long size, boolean cacheMoved) {
        tracker.remove(sourceKey);
        // dest now holds the source's content; whatever was cached under it is stale
        tracker.remove(destKey);
        if (!cacheMoved) {
            log.debugf("Dropping stale cache entry %s after rename from %s", destKey, sourceKey);
            return deleteFromCache(destKey);
        }
        if (size != null) {
            log.debugf("Renamed cache entry %s to %s", sourceKey, destKey);
            return evict(tracker.record(destKey, size));
        }
        // untracked cached copy cannot be budgeted
        return deleteFromCache(destKey);
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return fallbackTier.exists(key);
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().deferred(() -> {
            log.debugf("Deleting %s from both tiers", key);
            tracker.remove(key);
            // cache deletion never fails, so the outcome is the fallback tier's
            return StreamTee.both(
                            deleteFromCache(key).replaceWith(Boolean.TRUE),
                            fallbackTier.delete(key).replaceWith(Boolean.TRUE))
                    .replaceWithVoid();
        });
    }

    /**
     * Extension capabilities, resolved once at construction:
     * <ul>
     *   <li>{@value Capabilities#STATS} is answered by this store itself.</li>
     *   <li>A capability of the cache tier runs there first, then on the fallback tier
     *       if it has one of the same name; the cache tier's result is returned.</li>
     *   <li>A capability only the fallback tier has runs there.</li>
     * </ul>
     */
    @Override
    public Map<String, StoreCapability> capabilities() {
        return capabilities;
    }

    private Map<String, StoreCapability> composeCapabilities() {
        Map<String, StoreCapability> composed = new LinkedHashMap<>();
        composed.put(Capabilities.STATS, args -> Uni.createFrom().item(stats()));

        Map<String, StoreCapability> onCache = cacheTier.capabilities();
        Map<String, StoreCapability> onFallback = fallbackTier.capabilities();

        onCache.forEach((name, cacheCapability) -> {
            if (composed.containsKey(name)) {
                return;
            }
            StoreCapability fallbackCapability = onFallback.get(name);
            composed.put(name, args -> {
                log.debugf("Forwarding %s to cache tier", name);
                Uni<Object> result = cacheCapability.invoke(args);
                if (fallbackCapability == null) {
                    return result;
                }
                return result.onItem().call(ignored -> {
                    log.debugf("Forwarding %s to fallback tier", name);
                    return fallbackCapability.invoke(args);
                });
            });
        });

        onFallback.forEach((name, fallbackCapability) -> {
            if (composed.containsKey(name)) {
                return;
            }
            composed.put(name, args -> {
                log.debugf("Forwarding %s to fallback tier", name);
                return fallbackCapability.invoke(args);
            });
        });

        log.debugf("Tiered store capabilities: %s", composed.keySet());
        return Collections.unmodifiableMap(composed);
    }

    private Uni<Void> register(String key, long size) {
        List<String> evicted = tracker.record(key, size);
        log.debugf("Cached %s (%d bytes), cache size: %s", key, size, tracker.stats());
        return evict(evicted);
    }

    private Uni<Void> evict(List<String> keys) {
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (String key : keys) {
            chain = chain.chain(() -> {
                log.debugf("Evicting %s from cache tier", key);
                return deleteFromCache(key);
            });
        }
        return chain;
    }

    private Uni<Void> deleteFromCache(String key) {
        return cacheTier.delete(key)
                .onFailure(BlobNotFoundException.class).recoverWithNull()
                .onFailure().invoke(e -> log.warnf(e, "Failed to delete %s from cache tier", key))
                .onFailure().recoverWithNull();
    }
}
