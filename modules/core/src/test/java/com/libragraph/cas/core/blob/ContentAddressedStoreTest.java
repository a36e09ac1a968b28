package com.libragraph.cas.core.blob;

import com.libragraph.cas.core.storage.BlobNotFoundException;
import com.libragraph.cas.core.storage.DirectoryStore;
import com.libragraph.cas.core.storage.MemoryStore;
import com.libragraph.cas.core.storage.StorageException;
import com.libragraph.cas.core.storage.Store;
import com.libragraph.cas.core.storage.TieredCacheStore;
import com.libragraph.cas.core.stream.ChunkStreams;
import com.libragraph.cas.util.ContentHasher;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import io.smallrye.mutiny.tuples.Tuple2;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ContentAddressedStoreTest {

    enum Backend { MEMORY, DIRECTORY, TIERED }

    @TempDir
    Path tempDir;

    private Store store(Backend backend) {
        switch (backend) {
            case MEMORY:
                return new MemoryStore();
            case DIRECTORY:
                return new DirectoryStore(tempDir.resolve("store"));
            case TIERED:
                return new TieredCacheStore(new MemoryStore(), new DirectoryStore(tempDir.resolve("store")), 1024);
            default:
                throw new IllegalArgumentException(backend.name());
        }
    }

    private ContentAddressedStore cas(Backend backend) {
        return ContentAddressedStore.builder(store(backend)).build();
    }

    private static Multi<byte[]> failing(String content, RuntimeException failure) {
        return Multi.createBy().concatenating().streams(
                ChunkStreams.of(content.getBytes()), Multi.createFrom().failure(failure));
    }

    private List<Path> storedFiles() throws IOException {
        Path root = tempDir.resolve("store");
        if (!Files.exists(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile).collect(Collectors.toList());
        }
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void putsBufferUnderHashKey(Backend backend) {
        ContentAddressedStore cas = cas(backend);
        byte[] data = "hello world".getBytes();

        BlobInfo info = cas.put(data).await().indefinitely();

        assertThat(info.finalized()).isTrue();
        assertThat(info.size()).isEqualTo(11L);
        assertThat(info.hash()).isEqualTo(ContentHasher.hash(ContentHasher.BLAKE3, data));
        assertThat(info.key()).isEqualTo(info.hash().toHex());
        assertThat(cas.readFile(info).await().indefinitely()).isEqualTo(data);
        assertThat(cas.has(info).await().indefinitely()).isTrue();
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void identicalContentSharesKey(Backend backend) {
        ContentAddressedStore cas = cas(backend);

        BlobInfo first = cas.put("same bytes".getBytes()).await().indefinitely();
        BlobInfo second = cas.put(ChunkStreams.of("same bytes".getBytes())).await().indefinitely();
        BlobInfo other = cas.put("other bytes".getBytes()).await().indefinitely();

        assertThat(second.key()).isEqualTo(first.key());
        assertThat(second.hash()).isEqualTo(first.hash());
        assertThat(other.key()).isNotEqualTo(first.key());
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void putsFileAndStream(Backend backend) throws IOException {
        ContentAddressedStore cas = cas(backend);
        byte[] data = new byte[50_000];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) (i * 31);
        }
        Path file = tempDir.resolve("input.bin");
        Files.write(file, data);

        BlobInfo fromFile = cas.put(file).await().indefinitely();
        BlobInfo fromStream = cas.put(new ByteArrayInputStream(data), BlobMetadata.empty()).await().indefinitely();

        assertThat(fromFile.key()).isEqualTo(fromStream.key());
        assertThat(fromFile.meta().extension()).contains(".bin");
        assertThat(cas.readFile(fromFile.key()).await().indefinitely()).isEqualTo(data);
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void failingSourcePropagatesAndLeavesNothing(Backend backend) throws IOException {
        Store store = store(backend);
        ContentAddressedStore cas = ContentAddressedStore.builder(store).build();
        RuntimeException boom = new RuntimeException("aargh");

        assertThatThrownBy(() -> cas.put(failing("hello", boom)).await().indefinitely())
                .isSameAs(boom)
                .hasMessage("aargh");

        if (store instanceof MemoryStore) {
            assertThat(((MemoryStore) store).size()).isZero();
        } else {
            assertThat(storedFiles()).isEmpty();
        }
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void readMissingFailsWithEnoent(Backend backend) {
        ContentAddressedStore cas = cas(backend);

        assertThatThrownBy(() -> cas.readFile("nonexistent").await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class)
                .hasMessageContaining("ENOENT");
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void unlinkRemovesBlob(Backend backend) {
        ContentAddressedStore cas = cas(backend);
        BlobInfo info = cas.put("to be removed".getBytes()).await().indefinitely();

        cas.unlink(info).await().indefinitely();

        assertThat(cas.has(info.key()).await().indefinitely()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void hasContentChecksWithoutStoring(Backend backend) {
        ContentAddressedStore cas = cas(backend);
        cas.put("present".getBytes()).await().indefinitely();

        assertThat(cas.hasContent("present".getBytes(), BlobMetadata.empty()).await().indefinitely()).isTrue();
        assertThat(cas.hasContent("absent".getBytes(), BlobMetadata.empty()).await().indefinitely()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(Backend.class)
    void twoPhasePut(Backend backend) {
        ContentAddressedStore cas = cas(backend);

        BlobInfo prepared = cas.preparePut(ChunkStreams.of("staged".getBytes()), BlobMetadata.empty())
                .await().indefinitely();

        assertThat(prepared.finalized()).isFalse();
        assertThat(prepared.key()).startsWith(KeyDerivation.TEMPORARY_PREFIX);
        assertThat(prepared.hasHash()).isTrue();
        assertThat(cas.readFile(prepared).await().indefinitely()).isEqualTo("staged".getBytes());

        BlobInfo finalized = cas.finalizePut(prepared.key()).await().indefinitely();

        assertThat(finalized.key()).isEqualTo(prepared.hash().toHex());
        assertThat(cas.has(prepared.key()).await().indefinitely()).isFalse();
        assertThat(cas.readFile(finalized).await().indefinitely()).isEqualTo("staged".getBytes());
    }

    @ParameterizedTest
    @EnumSource(value = Backend.class, names = {"DIRECTORY", "TIERED"})
    void concurrentIdenticalPutsConvergeOnOneCopy(Backend backend) throws IOException {
        Store store = store(backend);
        ContentAddressedStore cas = ContentAddressedStore.builder(store).build();
        byte[] data = new byte[600];
        Arrays.fill(data, (byte) 'c');

        Tuple2<BlobInfo, BlobInfo> both = Uni.combine().all().unis(
                        cas.put(data).runSubscriptionOn(Infrastructure.getDefaultExecutor()),
                        cas.put(data).runSubscriptionOn(Infrastructure.getDefaultExecutor()))
                .asTuple()
                .await().atMost(Duration.ofSeconds(10));

        String key = both.getItem1().key();
        assertThat(both.getItem2().key()).isEqualTo(key);
        assertThat(cas.readFile(key).await().indefinitely()).isEqualTo(data);
        assertThat(storedFiles()).containsExactly(tempDir.resolve("store").resolve(key));
        if (store instanceof TieredCacheStore) {
            assertThat(((MemoryStore) ((TieredCacheStore) store).cacheTier()).keys()).allMatch(key::equals);
        }
        assertThat(cas.preparedCount()).isZero();
    }

    @Test
    void unlinkingPreparedBlobForgetsIt() {
        ContentAddressedStore cas = cas(Backend.MEMORY);

        for (int i = 0; i < 100; i++) {
            BlobInfo info = cas.preparePut(ChunkStreams.of(("abandoned " + i).getBytes()), BlobMetadata.empty())
                    .await().indefinitely();
            cas.unlink(info).await().indefinitely();
        }

        assertThat(cas.preparedCount()).isZero();
    }

    @Test
    void failedFinalizeForgetsPreparedBlob() {
        MemoryStore store = new MemoryStore();
        ContentAddressedStore cas = ContentAddressedStore.builder(store).build();
        BlobInfo info = cas.preparePut(ChunkStreams.of("lost".getBytes()), BlobMetadata.empty())
                .await().indefinitely();
        assertThat(cas.preparedCount()).isEqualTo(1);
        store.delete(info.key()).await().indefinitely();

        assertThatThrownBy(() -> cas.finalizePut(info.key()).await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);

        assertThat(cas.preparedCount()).isZero();
    }

    @Test
    void inputStreamIsClosedWhenStoreFailsUpFront() throws IOException {
        Path notADirectory = Files.writeString(tempDir.resolve("plain-file"), "in the way");
        ContentAddressedStore cas = ContentAddressedStore.builder(new DirectoryStore(notADirectory)).build();
        AtomicBoolean closed = new AtomicBoolean();
        ByteArrayInputStream in = new ByteArrayInputStream("never read".getBytes()) {
            @Override
            public void close() {
                closed.set(true);
            }
        };

        assertThatThrownBy(() -> cas.put(in, BlobMetadata.empty()).await().indefinitely())
                .isInstanceOf(StorageException.class);

        assertThat(closed).isTrue();
    }

    @Test
    void finalizeOfUnknownTemporaryKeyFails() {
        ContentAddressedStore cas = cas(Backend.MEMORY);

        assertThatThrownBy(() -> cas.finalizePut("tmp/unknown").await().indefinitely())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void finalizeOverwritesExistingContent() {
        MemoryStore store = new MemoryStore();
        ContentAddressedStore cas = ContentAddressedStore.builder(store).build();
        BlobInfo first = cas.put("dup".getBytes()).await().indefinitely();

        BlobInfo second = cas.put("dup".getBytes()).await().indefinitely();

        assertThat(second.key()).isEqualTo(first.key());
        assertThat(store.keys()).containsExactly(first.key());
    }

    @Test
    void customKeyDerivation() {
        ContentAddressedStore cas = ContentAddressedStore.builder(new MemoryStore())
                .keyDerivation(request -> request.isTemporary()
                        ? "staging/" + request.meta().get("name").orElse("anon")
                        : "blobs/" + request.hash().toHex().substring(0, 2) + "/" + request.hash().toHex())
                .build();

        BlobInfo info = cas.put("custom".getBytes(), BlobMetadata.of(Map.of("name", "doc")))
                .await().indefinitely();

        assertThat(info.key()).isEqualTo("blobs/" + info.hash().toHex().substring(0, 2) + "/" + info.hash().toHex());
        assertThat(cas.has("staging/doc").await().indefinitely()).isFalse();
    }

    @Test
    void keepExtensionAppendsExtension() {
        ContentAddressedStore cas = ContentAddressedStore.builder(new MemoryStore())
                .keepExtension(true)
                .build();

        BlobInfo info = cas.put("text".getBytes(), BlobMetadata.ofExtension(".txt")).await().indefinitely();

        assertThat(info.key()).isEqualTo(info.hash().toHex() + ".txt");
    }

    @Test
    void alternateHashAlgorithm() {
        ContentAddressedStore cas = ContentAddressedStore.builder(new MemoryStore())
                .hashAlgorithm("SHA-256")
                .build();

        BlobInfo info = cas.put("abc".getBytes()).await().indefinitely();

        assertThat(info.key()).isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    void rejectsUnknownHashAlgorithm() {
        assertThatThrownBy(() -> ContentAddressedStore.builder(new MemoryStore()).hashAlgorithm("NOPE-1").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void streamsToDestination() {
        ContentAddressedStore cas = cas(Backend.MEMORY);
        BlobInfo info = cas.put("piped".getBytes()).await().indefinitely();
        AtomicBoolean closed = new AtomicBoolean();
        ByteArrayOutputStream out = new ByteArrayOutputStream() {
            @Override
            public void close() {
                closed.set(true);
            }
        };

        long written = cas.stream(info, out).await().indefinitely();

        assertThat(written).isEqualTo(5);
        assertThat(out.toString()).isEqualTo("piped");
        assertThat(closed).isTrue();
    }

    @Test
    void streamCanKeepDestinationOpen() {
        ContentAddressedStore cas = cas(Backend.MEMORY);
        BlobInfo info = cas.put("open".getBytes()).await().indefinitely();
        AtomicBoolean closed = new AtomicBoolean();
        ByteArrayOutputStream out = new ByteArrayOutputStream() {
            @Override
            public void close() {
                closed.set(true);
            }
        };

        cas.stream(info.key(), out, StreamOptions.keepOpen()).await().indefinitely();

        assertThat(closed).isFalse();
    }

    @Test
    void temporaryFileCarriesExtensionAndIsDeletedOnClose() throws IOException {
        ContentAddressedStore cas = cas(Backend.MEMORY);
        BlobInfo info = cas.put("temp content".getBytes(), BlobMetadata.ofExtension(".txt")).await().indefinitely();

        Path path;
        try (TemporaryFile file = cas.getTemporaryFile(info, TemporaryFileOptions.defaults().withDirectory(tempDir))
                .await().indefinitely()) {
            path = file.path();
            assertThat(path.getFileName().toString()).startsWith("cas-").endsWith(".txt");
            assertThat(Files.readString(path)).isEqualTo("temp content");
        }
        assertThat(path).doesNotExist();
    }

    @Test
    void failedDownloadRemovesTemporaryFile() throws IOException {
        Path downloads = Files.createDirectory(tempDir.resolve("downloads"));
        ContentAddressedStore cas = cas(Backend.MEMORY);

        assertThatThrownBy(() -> cas.getTemporaryFile("missing", null,
                TemporaryFileOptions.defaults().withDirectory(downloads)).await().indefinitely())
                .isInstanceOf(BlobNotFoundException.class);

        try (Stream<Path> left = Files.list(downloads)) {
            assertThat(left).isEmpty();
        }
    }

    @Test
    void withTemporaryFileDeletesAfterAction() {
        ContentAddressedStore cas = cas(Backend.MEMORY);
        BlobInfo info = cas.put("scoped".getBytes()).await().indefinitely();
        AtomicReference<Path> seen = new AtomicReference<>();

        String content = cas.withTemporaryFile(info, path -> {
            seen.set(path);
            return Uni.createFrom().item(() -> readString(path));
        }).await().indefinitely();

        assertThat(content).isEqualTo("scoped");
        assertThat(seen.get()).doesNotExist();
    }

    @Test
    void withTemporaryFileDeletesWhenActionFails() {
        ContentAddressedStore cas = cas(Backend.MEMORY);
        BlobInfo info = cas.put("scoped".getBytes()).await().indefinitely();
        AtomicReference<Path> seen = new AtomicReference<>();
        RuntimeException boom = new RuntimeException("action failed");

        assertThatThrownBy(() -> cas.withTemporaryFile(info, path -> {
            seen.set(path);
            return Uni.createFrom().<String>failure(boom);
        }).await().indefinitely()).isSameAs(boom);

        assertThat(seen.get()).doesNotExist();
    }

    private static String readString(Path path) {
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }
}
