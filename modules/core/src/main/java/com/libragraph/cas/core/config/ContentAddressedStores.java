package com.libragraph.cas.core.config;

import com.libragraph.cas.core.blob.ContentAddressedStore;
import com.libragraph.cas.core.storage.Store;
import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfig;
import io.smallrye.config.SmallRyeConfigBuilder;

import java.util.Map;

/**
 * Entry points that wire a {@link ContentAddressedStore} from configuration.
 */
public final class ContentAddressedStores {

    private static final int OVERRIDE_ORDINAL = 500;

    private ContentAddressedStores() {
    }

    /**
     * Loads {@link CasConfig} from system properties, environment and
     * {@code META-INF/microprofile-config.properties}.
     */
    public static CasConfig loadConfig() {
        return loadConfig(Map.of());
    }

    /**
     * Same as {@link #loadConfig()}, with {@code overrides} taking precedence over every other source.
     */
    public static CasConfig loadConfig(Map<String, String> overrides) {
        SmallRyeConfig config = new SmallRyeConfigBuilder()
                .addDefaultSources()
                .addDefaultInterceptors()
                .withSources(new PropertiesConfigSource(overrides, "cas-overrides", OVERRIDE_ORDINAL))
                .withMapping(CasConfig.class)
                .build();
        return config.getConfigMapping(CasConfig.class);
    }

    public static ContentAddressedStore fromConfig() {
        return fromConfig(loadConfig());
    }

    public static ContentAddressedStore fromConfig(Map<String, String> overrides) {
        return fromConfig(loadConfig(overrides));
    }

    public static ContentAddressedStore fromConfig(CasConfig config) {
        Store store = StoreFactory.create(config);
        return ContentAddressedStore.builder(store)
                .hashAlgorithm(config.hashAlgorithm())
                .keepExtension(config.keepExtension())
                .build();
    }
}
