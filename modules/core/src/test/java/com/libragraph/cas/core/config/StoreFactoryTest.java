package com.libragraph.cas.core.config;

import com.libragraph.cas.core.blob.BlobInfo;
import com.libragraph.cas.core.blob.BlobMetadata;
import com.libragraph.cas.core.blob.ContentAddressedStore;
import com.libragraph.cas.core.storage.DirectoryStore;
import com.libragraph.cas.core.storage.MemoryStore;
import com.libragraph.cas.core.storage.Store;
import com.libragraph.cas.core.storage.TieredCacheStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.*;

class StoreFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsToMemoryWithBlake3() {
        CasConfig config = ContentAddressedStores.loadConfig();

        assertThat(config.hashAlgorithm()).isEqualTo("BLAKE3");
        assertThat(config.keepExtension()).isFalse();
        assertThat(config.store().type()).isEqualTo(CasConfig.StoreType.MEMORY);
        assertThat(config.store().s3().bucket()).isEqualTo("cas");
        assertThat(StoreFactory.create(config)).isInstanceOf(MemoryStore.class);
    }

    @Test
    void buildsDirectoryStore() {
        Store store = StoreFactory.create(ContentAddressedStores.loadConfig(Map.of(
                "cas.store.type", "directory",
                "cas.store.directory.root", tempDir.toString())));

        assertThat(store).isInstanceOf(DirectoryStore.class);
        assertThat(((DirectoryStore) store).base()).isEqualTo(tempDir.toAbsolutePath().normalize());
    }

    @Test
    void buildsTieredStore() {
        Store store = StoreFactory.create(ContentAddressedStores.loadConfig(Map.of(
                "cas.store.type", "tiered",
                "cas.store.directory.root", tempDir.toString(),
                "cas.store.tiered.byte-budget", "2048")));

        assertThat(store).isInstanceOf(TieredCacheStore.class);
        TieredCacheStore tiered = (TieredCacheStore) store;
        assertThat(tiered.cacheTier()).isInstanceOf(MemoryStore.class);
        assertThat(tiered.fallbackTier()).isInstanceOf(DirectoryStore.class);
        assertThat(tiered.stats().byteBudget()).isEqualTo(2048);
    }

    @Test
    void rejectsNestedTiers() {
        CasConfig config = ContentAddressedStores.loadConfig(Map.of(
                "cas.store.type", "tiered",
                "cas.store.tiered.fallback-type", "tiered"));

        assertThatThrownBy(() -> StoreFactory.create(config)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void directoryStoreRequiresRoot() {
        CasConfig config = ContentAddressedStores.loadConfig(Map.of("cas.store.type", "directory"));

        assertThatThrownBy(() -> StoreFactory.create(config))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("cas.store.directory.root");
    }

    @Test
    void wiresFacadeFromConfig() {
        ContentAddressedStore cas = ContentAddressedStores.fromConfig(Map.of(
                "cas.hash-algorithm", "SHA-256",
                "cas.keep-extension", "true"));

        BlobInfo info = cas.put("abc".getBytes(),
                BlobMetadata.ofExtension(".txt")).await().indefinitely();

        assertThat(cas.hashAlgorithm()).isEqualTo("SHA-256");
        assertThat(info.key()).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad.txt");
    }
}
