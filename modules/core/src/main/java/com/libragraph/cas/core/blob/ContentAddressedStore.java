package com.libragraph.cas.core.blob;

import com.libragraph.cas.core.storage.StorageException;
import com.libragraph.cas.core.storage.Store;
import com.libragraph.cas.core.stream.ChunkStreams;
import com.libragraph.cas.core.stream.StreamTee;
import com.libragraph.cas.util.ContentHasher;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Content-addressed facade over a {@link Store}.
 *
 * <p>A put runs in two phases. {@link #preparePut} streams the content under a
 * temporary key while hashing it on the fly; {@link #finalizePut} renames the entry
 * to the key derived from the hash. Renames overwrite, so identical content always
 * ends up as a single stored copy.
 *
 * <p>Every operation is lazy and reports failures through the returned {@link Uni}.
 */
public class ContentAddressedStore {

    private final Store store;
    private final String hashAlgorithm;
    private final KeyDerivation keyDerivation;
    private final Logger log;

    // temporary key -> prepared info, until finalized
    private final ConcurrentHashMap<String, BlobInfo> prepared = new ConcurrentHashMap<>();

    private ContentAddressedStore(Builder builder) {
        this.store = builder.store;
        this.hashAlgorithm = ContentHasher.checkAlgorithm(builder.hashAlgorithm);
        this.keyDerivation = builder.keyDerivation != null
                ? builder.keyDerivation
                : KeyDerivation.defaults(builder.keepExtension);
        this.log = builder.logger != null ? builder.logger : Logger.getLogger(ContentAddressedStore.class);
    }

    public static Builder builder(Store store) {
        return new Builder(store);
    }

    public Store store() {
        return store;
    }

    public String hashAlgorithm() {
        return hashAlgorithm;
    }

    // -- put --

    /**
     * Streams {@code source} to the store under a temporary key and hashes it on the way.
     * Completes once the store has the data and the hash is complete.
     *
     * <p>If the source fails, the returned Uni fails with that same exception.
     */
    public Uni<BlobInfo> preparePut(Multi<byte[]> source, BlobMetadata meta) {
        Objects.requireNonNull(meta, "meta cannot be null");
        return Uni.createFrom().deferred(() -> {
            String temporaryKey = keyDerivation.deriveKey(KeyRequest.temporary(meta));
            log.debugf("Preparing put under temporary key %s", temporaryKey);

            Multi<byte[]> shared = StreamTee.split(source, 2);
            Uni<ContentHasher> digest = shared.collect()
                    .in(() -> ContentHasher.create(hashAlgorithm), ContentHasher::update);

            return StreamTee.both(store.write(temporaryKey, shared).replaceWith(Boolean.TRUE), digest)
                    .map(done -> {
                        ContentHasher hasher = done.getItem2();
                        return BlobInfo.prepared(temporaryKey, hasher.finish(), hasher.size(), meta);
                    })
                    .invoke(info -> {
                        prepared.put(temporaryKey, info);
                        log.debugf("Prepared %s: %d bytes, %s %s",
                                temporaryKey, info.size(), hashAlgorithm, info.hash());
                    });
        });
    }

    /**
     * Moves a prepared blob to its content-derived key, replacing whatever is stored there.
     */
    public Uni<BlobInfo> finalizePut(BlobInfo info) {
        Objects.requireNonNull(info, "info cannot be null");
        if (info.finalized()) {
            return Uni.createFrom().item(info);
        }
        if (!info.hasHash()) {
            return Uni.createFrom().failure(
                    new IllegalArgumentException("Blob has not been prepared: " + info.key()));
        }
        return Uni.createFrom().deferred(() -> {
            String finalKey = keyDerivation.deriveKey(KeyRequest.content(info.hash(), info.size(), info.meta()));
            Uni<Void> move = finalKey.equals(info.key())
                    ? Uni.createFrom().voidItem()
                    : store.rename(info.key(), finalKey);
            return move
                    .invoke(() -> log.debugf("Finalized %s as %s", info.key(), finalKey))
                    .map(ignored -> info.finalizedAs(finalKey))
                    // a failed rename is not retried under the same temporary key
                    .onTermination().invoke(() -> prepared.remove(info.key()));
        });
    }

    /**
     * Finalizes a blob prepared by this instance, identified by its temporary key.
     * Only blobs neither finalized nor unlinked yet are known.
     */
    public Uni<BlobInfo> finalizePut(String temporaryKey) {
        BlobInfo info = prepared.get(temporaryKey);
        if (info == null) {
            return Uni.createFrom().failure(
                    new IllegalArgumentException("No prepared blob under temporary key: " + temporaryKey));
        }
        return finalizePut(info);
    }

    public Uni<BlobInfo> put(Multi<byte[]> source, BlobMetadata meta) {
        return preparePut(source, meta).chain(this::finalizePut);
    }

    public Uni<BlobInfo> put(Multi<byte[]> source) {
        return put(source, BlobMetadata.empty());
    }

    public Uni<BlobInfo> put(byte[] data, BlobMetadata meta) {
        return put(ChunkStreams.of(data), meta);
    }

    public Uni<BlobInfo> put(byte[] data) {
        return put(data, BlobMetadata.empty());
    }

    public Uni<BlobInfo> put(Path file, BlobMetadata meta) {
        return put(ChunkStreams.of(file), meta);
    }

    /**
     * Stores a file, taking the metadata extension from its name.
     */
    public Uni<BlobInfo> put(Path file) {
        return put(file, BlobMetadata.ofFileName(file.getFileName().toString()));
    }

    /**
     * Stores the remaining content of {@code in} and closes it, whatever the outcome.
     */
    public Uni<BlobInfo> put(InputStream in, BlobMetadata meta) {
        // the store may fail before it ever subscribes to the stream
        return put(ChunkStreams.of(in), meta)
                .onFailure().invoke(() -> closeSource(in))
                .onCancellation().invoke(() -> closeSource(in));
    }

    // -- read --

    /**
     * Pipes a blob into {@code destination}.
     *
     * @return number of bytes written
     */
    public Uni<Long> stream(String key, OutputStream destination, StreamOptions options) {
        return store.read(key)
                .onItem().invoke(chunk -> {
                    try {
                        destination.write(chunk);
                    } catch (IOException e) {
                        throw new StorageException("Failed to write " + key + " to destination", e);
                    }
                })
                .collect().with(Collectors.summingLong(chunk -> (long) chunk.length))
                .onTermination().invoke(() -> {
                    if (options.closeDestination()) {
                        closeDestination(destination, key);
                    }
                });
    }

    public Uni<Long> stream(BlobInfo info, OutputStream destination, StreamOptions options) {
        return stream(info.key(), destination, options);
    }

    public Uni<Long> stream(String key, OutputStream destination) {
        return stream(key, destination, StreamOptions.defaults());
    }

    public Uni<Long> stream(BlobInfo info, OutputStream destination) {
        return stream(info.key(), destination, StreamOptions.defaults());
    }

    /**
     * Reads a whole blob into memory.
     *
     * @throws com.libragraph.cas.core.storage.BlobNotFoundException if absent
     */
    public Uni<byte[]> readFile(String key) {
        return ChunkStreams.collect(store.read(key));
    }

    public Uni<byte[]> readFile(BlobInfo info) {
        return readFile(info.key());
    }

    // -- existence and removal --

    public Uni<Boolean> has(String key) {
        return store.exists(key);
    }

    public Uni<Boolean> has(BlobInfo info) {
        return has(info.key());
    }

    /**
     * Hashes {@code source} completely, then checks whether its final key exists.
     */
    public Uni<Boolean> hasContent(Multi<byte[]> source, BlobMetadata meta) {
        return source.collect()
                .in(() -> ContentHasher.create(hashAlgorithm), ContentHasher::update)
                .chain(hasher -> {
                    String key = keyDerivation.deriveKey(KeyRequest.content(hasher.finish(), hasher.size(), meta));
                    log.debugf("Checking for content under %s", key);
                    return store.exists(key);
                });
    }

    public Uni<Boolean> hasContent(byte[] data, BlobMetadata meta) {
        return hasContent(ChunkStreams.of(data), meta);
    }

    /**
     * Deletes a blob. Unlinking a prepared, unfinalized blob also forgets it.
     */
    public Uni<Void> unlink(String key) {
        return store.delete(key)
                .invoke(() -> log.debugf("Unlinked %s", key))
                .onTermination().invoke(() -> prepared.remove(key));
    }

    public Uni<Void> unlink(BlobInfo info) {
        return unlink(info.key());
    }

    // -- temporary files --

    /**
     * Downloads a blob to a new temporary file. The caller must close the returned
     * {@link TemporaryFile}; if the download fails, the file is removed before the
     * failure is reported.
     */
    public Uni<TemporaryFile> getTemporaryFile(String key, String extension, TemporaryFileOptions options) {
        return Uni.createFrom().deferred(() -> {
            String suffix = options.suffix() != null ? options.suffix() : extension;
            Path path;
            try {
                path = options.directory() != null
                        ? Files.createTempFile(options.directory(), options.prefix(), suffix)
                        : Files.createTempFile(options.prefix(), suffix);
            } catch (IOException e) {
                return Uni.createFrom().failure(new StorageException("Failed to create temporary file for " + key, e));
            }
            TemporaryFile file = new TemporaryFile(path);
            // from here on every failure goes through the cleanup below
            return Uni.createFrom().item(() -> openTemporaryFile(path, key))
                    .chain(out -> stream(key, out, StreamOptions.defaults()))
                    .invoke(bytes -> log.debugf("Wrote %s (%d bytes) to %s", key, bytes, file.path()))
                    .replaceWith(file)
                    .onFailure().call(e -> Uni.createFrom().voidItem().invoke(file::close))
                    .onCancellation().invoke(file::close);
        });
    }

    public Uni<TemporaryFile> getTemporaryFile(BlobInfo info, TemporaryFileOptions options) {
        return getTemporaryFile(info.key(), info.meta().extension().orElse(null), options);
    }

    public Uni<TemporaryFile> getTemporaryFile(BlobInfo info) {
        return getTemporaryFile(info, TemporaryFileOptions.defaults());
    }

    /**
     * Downloads a blob to a temporary file, runs {@code action} on its path and deletes
     * the file when the action terminates, whatever the outcome.
     */
    public <T> Uni<T> withTemporaryFile(BlobInfo info, TemporaryFileOptions options,
                                        Function<Path, Uni<T>> action) {
        return getTemporaryFile(info, options)
                .chain(file -> Uni.createFrom().deferred(() -> action.apply(file.path()))
                        .eventually(file::close));
    }

    public <T> Uni<T> withTemporaryFile(BlobInfo info, Function<Path, Uni<T>> action) {
        return withTemporaryFile(info, TemporaryFileOptions.defaults(), action);
    }

    /**
     * Number of prepared blobs not yet finalized or unlinked.
     */
    public int preparedCount() {
        return prepared.size();
    }

    private static OutputStream openTemporaryFile(Path path, String key) {
        try {
            return Files.newOutputStream(path);
        } catch (IOException e) {
            throw new StorageException("Failed to open temporary file for " + key + ": " + path, e);
        }
    }

    private void closeSource(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debugf(e, "Failed to close source stream");
        }
    }

    private void closeDestination(OutputStream destination, String key) {
        try {
            destination.close();
        } catch (IOException e) {
            log.warnf(e, "Failed to close destination for %s", key);
        }
    }

    /**
     * Builder mirroring the construction options: store, hash algorithm,
     * key derivation, extension handling and logger.
     */
    public static final class Builder {
        private final Store store;
        private String hashAlgorithm = ContentHasher.DEFAULT_ALGORITHM;
        private KeyDerivation keyDerivation;
        private boolean keepExtension;
        private Logger logger;

        private Builder(Store store) {
            this.store = Objects.requireNonNull(store, "store cannot be null");
        }

        public Builder hashAlgorithm(String hashAlgorithm) {
            this.hashAlgorithm = Objects.requireNonNull(hashAlgorithm, "hashAlgorithm cannot be null");
            return this;
        }

        /**
         * Custom key derivation; overrides {@link #keepExtension(boolean)}.
         */
        public Builder keyDerivation(KeyDerivation keyDerivation) {
            this.keyDerivation = keyDerivation;
            return this;
        }

        public Builder keepExtension(boolean keepExtension) {
            this.keepExtension = keepExtension;
            return this;
        }

        public Builder logger(Logger logger) {
            this.logger = logger;
            return this;
        }

        public ContentAddressedStore build() {
            return new ContentAddressedStore(this);
        }
    }
}
