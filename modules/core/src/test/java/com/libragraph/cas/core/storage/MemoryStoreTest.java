package com.libragraph.cas.core.storage;

import com.libragraph.cas.core.stream.ChunkStreams;
import io.smallrye.mutiny.Multi;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MemoryStoreTest {

    private final MemoryStore store = new MemoryStore();

    private byte[] read(String key) {
        return ChunkStreams.collect(store.read(key)).await().indefinitely();
    }

    @Test
    void writeAndReadRoundTrip() {
        store.write("a", ChunkStreams.of("hello memory".getBytes())).await().indefinitely();

        assertThat(read("a")).isEqualTo("hello memory".getBytes());
        assertThat(store.exists("a").await().indefinitely()).isTrue();
        assertThat(store.keys()).containsExactly("a");
    }

    @Test
    void writeOverwrites() {
        store.write("a", ChunkStreams.of("first".getBytes())).await().indefinitely();
        store.write("a", ChunkStreams.of("second".getBytes())).await().indefinitely();

        assertThat(read("a")).isEqualTo("second".getBytes());
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void failedSourceLeavesNothing() {
        RuntimeException boom = new RuntimeException("aargh");
        Multi<byte[]> source = Multi.createBy().concatenating().streams(
                ChunkStreams.of("partial".getBytes()), Multi.createFrom().failure(boom));

        assertThatThrownBy(() -> store.write("a", source).await().indefinitely()).isSameAs(boom);
        assertThat(store.exists("a").await().indefinitely()).isFalse();
    }

    @Test
    void readMissingFailsWithNotFound() {
        assertThatThrownBy(() -> read("missing"))
                .isInstanceOf(BlobNotFoundException.class)
                .hasMessageStartingWith("ENOENT");
    }

    @Test
    void renameMovesEntry() {
        store.write("a", ChunkStreams.of("moved".getBytes())).await().indefinitely();

        store.rename("a", "b").await().indefinitely();

        assertThat(store.keys()).containsExactly("b");
        assertThat(read("b")).isEqualTo("moved".getBytes());
    }

    @Test
    void renameMissingFailsWithNotFound() {
        assertThatThrownBy(() -> store.rename("missing", "b").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);
    }

    @Test
    void deleteMissingIsNoOp() {
        store.delete("missing").await().indefinitely();
        assertThat(store.size()).isZero();
    }

    @Test
    void offersNoCapabilities() {
        assertThat(store.supports(Capabilities.COPY)).isFalse();
        assertThatThrownBy(() -> store.invoke(Capabilities.COPY, "a", "b").await().indefinitely())
                .isInstanceOf(CapabilityNotFoundException.class)
                .satisfies(e -> assertThat(((CapabilityNotFoundException) e).capability()).isEqualTo("copy"));
    }
}
