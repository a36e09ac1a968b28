package com.libragraph.cas.core.stream;

import com.libragraph.cas.util.buffer.BinaryData;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Factories for chunked byte streams.
 *
 * <p>A blob travels as a {@code Multi<byte[]>}. Chunks are never mutated once emitted,
 * so several subscribers may safely see the same array. All sources below are pull-based:
 * nothing is read before downstream demand arrives.
 */
public final class ChunkStreams {

    private static final Logger log = Logger.getLogger(ChunkStreams.class);

    public static final int CHUNK_SIZE = 8192;

    private ChunkStreams() {
    }

    /**
     * Streams an in-memory array. Re-subscribable.
     */
    public static Multi<byte[]> of(byte[] data) {
        return Multi.createFrom().deferred(() -> {
            if (data.length <= CHUNK_SIZE) {
                return data.length == 0
                        ? Multi.createFrom().empty()
                        : Multi.createFrom().item(data.clone());
            }
            return Multi.createFrom().range(0, (data.length + CHUNK_SIZE - 1) / CHUNK_SIZE)
                    .map(i -> Arrays.copyOfRange(data, i * CHUNK_SIZE,
                            Math.min(data.length, (i + 1) * CHUNK_SIZE)));
        });
    }

    /**
     * Streams a file. The file is opened on subscription and closed on termination.
     * A missing file fails the stream with {@link java.nio.file.NoSuchFileException}.
     */
    public static Multi<byte[]> of(Path path) {
        return Multi.createFrom().deferred(() -> {
            InputStream in;
            try {
                in = Files.newInputStream(path);
            } catch (IOException e) {
                return Multi.createFrom().failure(e);
            }
            return of(in);
        });
    }

    /**
     * Streams an already open InputStream and closes it on termination.
     * Not re-subscribable: the stream is consumed by the first subscriber.
     */
    public static Multi<byte[]> of(InputStream in) {
        return Multi.createFrom().<InputStream, byte[]>generator(() -> in, (stream, emitter) -> {
                    try {
                        byte[] chunk = stream.readNBytes(CHUNK_SIZE);
                        if (chunk.length == 0) {
                            emitter.complete();
                        } else {
                            emitter.emit(chunk);
                        }
                    } catch (IOException e) {
                        emitter.fail(e);
                    }
                    return stream;
                })
                .onTermination().invoke(() -> close(in));
    }

    /**
     * Streams the content of a buffer from position 0.
     * The buffer's position is shared, so it must not be read concurrently.
     */
    public static Multi<byte[]> of(BinaryData data) {
        return Multi.createFrom().deferred(() -> of(data.inputStream(0)));
    }

    /**
     * Concatenates all chunks into one array.
     */
    public static Uni<byte[]> collect(Multi<byte[]> source) {
        return source.collect()
                .in(ByteArrayOutputStream::new, (out, chunk) -> out.write(chunk, 0, chunk.length))
                .map(ByteArrayOutputStream::toByteArray);
    }

    private static void close(InputStream in) {
        try {
            in.close();
        } catch (IOException e) {
            log.debugf(e, "Failed to close source stream");
        }
    }
}
