package com.libragraph.cas.core.storage;

import com.libragraph.cas.core.stream.ChunkStreams;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.UUID;

/**
 * Filesystem-backed Store.
 *
 * <p>Layout: {@code {base}/{key}}. A key is always taken relative to the base, so
 * {@code /tmp/x} maps to {@code {base}/tmp/x}; keys escaping the base via {@code ..}
 * are rejected. Parent directories are created on demand.
 *
 * <p>Writes go to a hidden {@code .part} sibling that is moved into place on success
 * and removed on failure, so a failed write never leaves a readable entry.
 *
 * <p>Offers the {@value Capabilities#COPY} capability.
 */
public class DirectoryStore implements Store {

    private static final Logger log = Logger.getLogger(DirectoryStore.class);

    private final Path base;
    private final Map<String, StoreCapability> capabilities;

    public DirectoryStore(Path base) {
        this.base = base.toAbsolutePath().normalize();
        this.capabilities = Map.of(Capabilities.COPY, args -> copy(
                Capabilities.stringArg(Capabilities.COPY, args, 0),
                Capabilities.stringArg(Capabilities.COPY, args, 1)).onItem().castTo(Object.class));
    }

    public Path base() {
        return base;
    }

    /**
     * Maps a key to its absolute path under the base directory.
     *
     * @throws IllegalArgumentException if the key is empty or escapes the base
     */
    public Path resolve(String key) {
        String relative = key.replace('\\', '/');
        while (relative.startsWith("/")) {
            relative = relative.substring(1);
        }
        if (relative.isBlank()) {
            throw new IllegalArgumentException("Invalid key: '" + key + "'");
        }
        Path path = base.resolve(relative).normalize();
        if (!path.startsWith(base) || path.equals(base)) {
            throw new IllegalArgumentException("Key escapes base directory: " + key);
        }
        return path;
    }

    @Override
    public Uni<Void> write(String key, Multi<byte[]> source) {
        return Uni.createFrom().deferred(() -> {
            Path path = resolve(key);
            Path part = path.resolveSibling("." + path.getFileName() + "." + UUID.randomUUID() + ".part");
            FileChannel channel;
            try {
                channel = openForWrite(part);
            } catch (IOException e) {
                return Uni.createFrom().failure(new StorageException("Failed to open blob for writing: " + key, e));
            }
            return source
                    .onItem().invoke(chunk -> append(channel, chunk, key))
                    .onItem().ignoreAsUni()
                    .invoke(() -> commit(channel, part, path, key))
                    .onTermination().invoke((ignored, failure, cancelled) -> {
                        if (failure != null || cancelled) {
                            abandon(channel, part);
                        }
                    });
        });
    }

    @Override
    public Multi<byte[]> read(String key) {
        return Multi.createFrom().deferred(() -> {
            Path path = resolve(key);
            if (!Files.isRegularFile(path)) {
                return Multi.createFrom().failure(new BlobNotFoundException(key));
            }
            log.debugf("Streaming %s from %s", key, path);
            return ChunkStreams.of(path)
                    .onFailure(NoSuchFileException.class).transform(e -> new BlobNotFoundException(key, e))
                    .onFailure(IOException.class).transform(e -> new StorageException("Failed to read blob: " + key, e));
        });
    }

    @Override
    public Uni<Void> rename(String sourceKey, String destKey) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path from = resolve(sourceKey);
            Path to = resolve(destKey);
            try {
                Files.createDirectories(to.getParent());
                move(from, to);
                log.debugf("Moved %s to %s", from, to);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(sourceKey, e);
            } catch (IOException e) {
                throw new StorageException("Failed to rename blob: " + sourceKey + " -> " + destKey, e);
            }
        });
    }

    /**
     * Copies an entry, replacing {@code destKey} if present.
     *
     * @throws BlobNotFoundException if {@code sourceKey} is absent
     */
    public Uni<Void> copy(String sourceKey, String destKey) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path from = resolve(sourceKey);
            Path to = resolve(destKey);
            if (!Files.isRegularFile(from)) {
                throw new BlobNotFoundException(sourceKey);
            }
            try {
                Files.createDirectories(to.getParent());
                Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING);
                log.debugf("Copied %s to %s", from, to);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(sourceKey, e);
            } catch (IOException e) {
                throw new StorageException("Failed to copy blob: " + sourceKey + " -> " + destKey, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return Uni.createFrom().item(() -> Files.isRegularFile(resolve(key)));
    }

    @Override
    public Uni<Void> delete(String key) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolve(key);
            try {
                if (!Files.deleteIfExists(path)) {
                    throw new BlobNotFoundException(key);
                }
                log.debugf("Deleted %s", path);
                pruneEmptyParents(path.getParent());
            } catch (IOException e) {
                throw new StorageException("Failed to delete blob: " + key, e);
            }
        });
    }

    @Override
    public Map<String, StoreCapability> capabilities() {
        return capabilities;
    }

    private FileChannel openForWrite(Path part) throws IOException {
        Files.createDirectories(part.getParent());
        try {
            return FileChannel.open(part, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (NoSuchFileException e) {
            // parent pruned by a concurrent delete
            Files.createDirectories(part.getParent());
            return FileChannel.open(part, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        }
    }

    private void append(FileChannel channel, byte[] chunk, String key) {
        try {
            ByteBuffer buf = ByteBuffer.wrap(chunk);
            while (buf.hasRemaining()) {
                channel.write(buf);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to write blob: " + key, e);
        }
    }

    private void commit(FileChannel channel, Path part, Path path, String key) {
        try {
            channel.force(true);
            channel.close();
            move(part, path);
            log.debugf("Wrote %s to disk at %s", key, path);
        } catch (IOException e) {
            throw new StorageException("Failed to commit blob: " + key, e);
        }
    }

    private void abandon(FileChannel channel, Path part) {
        try {
            channel.close();
            Files.deleteIfExists(part);
        } catch (IOException e) {
            log.warnf(e, "Failed to remove partial write %s", part);
        }
    }

    private void move(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void pruneEmptyParents(Path dir) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(base) && current.startsWith(base)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            try {
                Files.delete(current);
            } catch (DirectoryNotEmptyException | NoSuchFileException e) {
                // raced with a concurrent write into the same directory
                break;
            }
            current = current.getParent();
        }
    }
}
