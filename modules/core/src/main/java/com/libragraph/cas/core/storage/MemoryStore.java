package com.libragraph.cas.core.storage;

import com.libragraph.cas.core.stream.ChunkStreams;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Store holding every blob as a byte array in a map.
 * Intended as a cache tier or for tests.
 *
 * <p>A write becomes visible only after its source completes. Deleting an
 * absent key is a no-op.
 */
public class MemoryStore implements Store {

    private static final Logger log = Logger.getLogger(MemoryStore.class);

    private final ConcurrentHashMap<String, byte[]> data = new ConcurrentHashMap<>();

    @Override
    public Uni<Void> write(String key, Multi<byte[]> source) {
        return ChunkStreams.collect(source)
                .invoke(bytes -> {
                    data.put(key, bytes);
                    log.debugf("Saved %d bytes under %s", bytes.length, key);
                })
                .replaceWithVoid();
    }

    @Override
    public Multi<byte[]> read(String key) {
        return Multi.createFrom().deferred(() -> {
            byte[] bytes = data.get(key);
            if (bytes == null) {
                return Multi.createFrom().failure(new BlobNotFoundException(key));
            }
            return ChunkStreams.of(bytes);
        });
    }

    @Override
    public Uni<Void> rename(String sourceKey, String destKey) {
        return Uni.createFrom().voidItem().invoke(() -> {
            byte[] bytes = data.remove(sourceKey);
            if (bytes == null) {
                throw new BlobNotFoundException(sourceKey);
            }
            data.put(destKey, bytes);
            log.debugf("Renamed %s to %s", sourceKey, destKey);
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> data.containsKey(key));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            if (data.remove(key) != null) {
                log.debugf("Deleted %s", key);
            }
        });
    }

    /**
     * Number of stored blobs.
     */
    public int size() {
        return data.size();
    }

    /**
     * Snapshot of the stored keys.
     */
    public Set<String> keys() {
        return Set.copyOf(data.keySet());
    }
}
