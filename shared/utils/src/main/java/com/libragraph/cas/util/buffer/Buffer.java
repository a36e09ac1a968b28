package com.libragraph.cas.util.buffer;

import com.libragraph.cas.util.ContentHash;
import com.libragraph.cas.util.ContentHasher;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;

/**
 * Writable buffer that extends BinaryData with write capabilities.
 *
 * Supports incremental hash computation during sequential writes:
 * - Tailing writes (appending) update hash incrementally
 * - Overwrites invalidate hash and trigger recomputation
 * - Gaps in writes fall back to full hash computation
 *
 * Backends: {@link RamBuffer} for small content, {@link FileBuffer} past
 * {@link #FILE_THRESHOLD}.
 */
public abstract class Buffer extends BinaryData {

    /** Size above which content should be spooled to a {@link FileBuffer}. */
    public static final long FILE_THRESHOLD = 4L * 1024 * 1024; // 4 MB

    private final String algorithm;
    private ContentHasher incrementalHash;
    private long hashedUpTo = 0;
    private ContentHash cachedHash = null;

    protected Buffer(String algorithm) {
        this.algorithm = algorithm;
        this.incrementalHash = ContentHasher.create(algorithm);
    }

    public String algorithm() {
        return algorithm;
    }

    /**
     * Appends a whole chunk at the current position.
     */
    public void append(byte[] chunk) throws IOException {
        ByteBuffer src = ByteBuffer.wrap(chunk);
        while (src.hasRemaining()) {
            write(src);
        }
    }

    @Override
    public int write(ByteBuffer src) throws IOException {
        long writePos = position();

        // Any write invalidates cached hash
        cachedHash = null;

        if (incrementalHash.isFinished() || writePos < hashedUpTo) {
            // Finalized or overwritten - restart incremental hash
            resetIncremental();
        }
        if (writePos == hashedUpTo) {
            // Tailing write - update incremental hash
            incrementalHash.update(src);
            hashedUpTo += src.remaining();
        }
        // else: gap (writePos > hashedUpTo) - can't update incrementally

        return doWrite(src);
    }

    @Override
    public SeekableByteChannel truncate(long newSize) throws IOException {
        if (newSize < size()) {
            cachedHash = null;
            if (newSize < hashedUpTo) {
                resetIncremental();
            }
        }
        return doTruncate(newSize);
    }

    @Override
    public ContentHash hash() {
        if (cachedHash != null) {
            return cachedHash;
        }

        if (hashedUpTo == size() && hashedUpTo > 0) {
            cachedHash = incrementalHash.finish();
            return cachedHash;
        }

        // Gaps, incomplete, or empty - compute full hash
        cachedHash = computeFullHash();
        return cachedHash;
    }

    /**
     * Subclasses implement actual write operation.
     */
    protected abstract int doWrite(ByteBuffer src) throws IOException;

    /**
     * Subclasses implement actual truncate operation.
     */
    protected abstract SeekableByteChannel doTruncate(long newSize) throws IOException;

    private void resetIncremental() {
        incrementalHash = ContentHasher.create(algorithm);
        hashedUpTo = 0;
    }

    private ContentHash computeFullHash() {
        try {
            long originalPos = position();
            position(0);

            ContentHasher hasher = ContentHasher.create(algorithm);
            ByteBuffer buffer = ByteBuffer.allocate(8192);

            while (read(buffer) != -1) {
                buffer.flip();
                hasher.update(buffer);
                buffer.clear();
            }

            position(originalPos);
            return hasher.finish();

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to compute hash", e);
        }
    }
}
