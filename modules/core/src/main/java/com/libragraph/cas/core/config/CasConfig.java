package com.libragraph.cas.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * Configuration under the {@code cas.*} prefix.
 * <pre>
 *   cas.hash-algorithm=BLAKE3
 *   cas.store.type=tiered
 *   cas.store.directory.root=/var/lib/cas
 *   cas.store.tiered.byte-budget=104857600
 * </pre>
 */
@ConfigMapping(prefix = "cas")
public interface CasConfig {

    @WithDefault("BLAKE3")
    String hashAlgorithm();

    /** Append the {@code ext} metadata entry to derived keys. */
    @WithDefault("false")
    boolean keepExtension();

    StoreConfig store();

    interface StoreConfig {

        @WithDefault("memory")
        StoreType type();

        DirectoryConfig directory();

        S3Config s3();

        TieredConfig tiered();
    }

    interface DirectoryConfig {

        Optional<String> root();
    }

    interface S3Config {

        Optional<String> endpoint();

        Optional<String> accessKey();

        Optional<String> secretKey();

        @WithDefault("cas")
        String bucket();
    }

    interface TieredConfig {

        @WithDefault("memory")
        StoreType cacheType();

        @WithDefault("directory")
        StoreType fallbackType();

        @WithDefault("104857600")
        long byteBudget();
    }

    enum StoreType {
        MEMORY,
        DIRECTORY,
        S3,
        TIERED
    }
}
