package com.libragraph.cas.core.config;

import com.libragraph.cas.core.storage.DirectoryStore;
import com.libragraph.cas.core.storage.MemoryStore;
import com.libragraph.cas.core.storage.S3Store;
import com.libragraph.cas.core.storage.Store;
import com.libragraph.cas.core.storage.TieredCacheStore;
import org.jboss.logging.Logger;

import java.nio.file.Path;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Builds the {@link Store} selected by {@code cas.store.type}.
 */
public final class StoreFactory {

    private static final Logger log = Logger.getLogger(StoreFactory.class);

    private StoreFactory() {
    }

    public static Store create(CasConfig config) {
        CasConfig.StoreConfig store = config.store();
        if (store.type() != CasConfig.StoreType.TIERED) {
            return create(store.type(), config);
        }

        CasConfig.TieredConfig tiered = store.tiered();
        if (tiered.cacheType() == CasConfig.StoreType.TIERED
                || tiered.fallbackType() == CasConfig.StoreType.TIERED) {
            throw new IllegalArgumentException("Tiers of a tiered store cannot themselves be tiered");
        }
        if (tiered.byteBudget() < 0) {
            throw new IllegalArgumentException("cas.store.tiered.byte-budget must be >= 0, got: " + tiered.byteBudget());
        }
        Store cache = create(tiered.cacheType(), config);
        Store fallback = create(tiered.fallbackType(), config);
        log.infof("Using tiered store: cache=%s, fallback=%s, budget=%d bytes",
                tiered.cacheType(), tiered.fallbackType(), tiered.byteBudget());
        return new TieredCacheStore(cache, fallback, tiered.byteBudget());
    }

    private static Store create(CasConfig.StoreType type, CasConfig config) {
        CasConfig.StoreConfig store = config.store();
        switch (type) {
            case MEMORY:
                log.debug("Using in-memory store");
                return new MemoryStore();
            case DIRECTORY: {
                Path root = Path.of(required(store.directory().root(), "cas.store.directory.root"));
                log.infof("Using directory store at %s", root);
                return new DirectoryStore(root);
            }
            case S3: {
                CasConfig.S3Config s3 = store.s3();
                String endpoint = required(s3.endpoint(), "cas.store.s3.endpoint");
                log.infof("Using S3 store at %s, bucket %s", endpoint, s3.bucket());
                return new S3Store(
                        S3Store.client(endpoint,
                                required(s3.accessKey(), "cas.store.s3.access-key"),
                                required(s3.secretKey(), "cas.store.s3.secret-key")),
                        s3.bucket(),
                        config.hashAlgorithm());
            }
            default:
                throw new IllegalArgumentException("Unsupported store type: " + type);
        }
    }

    private static String required(Optional<String> value, String property) {
        return value.filter(s -> !s.isBlank())
                .orElseThrow(() -> new NoSuchElementException("Missing configuration property: " + property));
    }
}
