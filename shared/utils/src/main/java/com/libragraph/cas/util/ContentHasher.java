package com.libragraph.cas.util;

import org.apache.commons.codec.digest.Blake3;
import org.apache.commons.codec.digest.DigestUtils;

import java.nio.ByteBuffer;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Objects;

/**
 * Incremental digest over a byte stream that also counts the bytes it has seen.
 *
 * <p>{@value #BLAKE3} produces a 128-bit BLAKE3 hash. Every other name is looked up
 * as a JDK {@link MessageDigest} algorithm (e.g. {@code SHA-256}, {@code SHA-1}).
 *
 * <p>Not thread-safe: one hasher per stream.
 */
public abstract class ContentHasher {

    public static final String BLAKE3 = "BLAKE3";
    public static final String DEFAULT_ALGORITHM = BLAKE3;

    private static final int BLAKE3_LENGTH = 16; // 128 bits

    private final String algorithm;
    private long size;
    private ContentHash result;

    protected ContentHasher(String algorithm) {
        this.algorithm = algorithm;
    }

    /**
     * Creates a hasher for the given algorithm name.
     *
     * @throws IllegalArgumentException if the JDK does not know the algorithm
     */
    public static ContentHasher create(String algorithm) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        if (BLAKE3.equals(algorithm.toUpperCase(Locale.ROOT))) {
            return new Blake3Hasher();
        }
        if (!DigestUtils.isAvailable(algorithm)) {
            throw new IllegalArgumentException("Unsupported hash algorithm: " + algorithm);
        }
        return new DigestHasher(algorithm, DigestUtils.getDigest(algorithm));
    }

    /**
     * Validates an algorithm name without keeping the hasher.
     */
    public static String checkAlgorithm(String algorithm) {
        create(algorithm);
        return algorithm;
    }

    /**
     * One-shot convenience for in-memory data.
     */
    public static ContentHash hash(String algorithm, byte[] data) {
        ContentHasher hasher = create(algorithm);
        hasher.update(data);
        return hasher.finish();
    }

    public String algorithm() {
        return algorithm;
    }

    public ContentHasher update(byte[] chunk) {
        return update(chunk, 0, chunk.length);
    }

    public ContentHasher update(byte[] chunk, int offset, int length) {
        if (result != null) {
            throw new IllegalStateException("Hasher already finished");
        }
        doUpdate(chunk, offset, length);
        size += length;
        return this;
    }

    /**
     * Feeds the remaining bytes of {@code src} without moving its position.
     */
    public ContentHasher update(ByteBuffer src) {
        ByteBuffer copy = src.duplicate();
        byte[] bytes = new byte[copy.remaining()];
        copy.get(bytes);
        return update(bytes);
    }

    /**
     * Number of bytes seen so far.
     */
    public long size() {
        return size;
    }

    public boolean isFinished() {
        return result != null;
    }

    /**
     * Completes the digest. Idempotent; no further updates are accepted.
     */
    public ContentHash finish() {
        if (result == null) {
            result = new ContentHash(doFinish());
        }
        return result;
    }

    protected abstract void doUpdate(byte[] chunk, int offset, int length);

    protected abstract byte[] doFinish();

    private static final class Blake3Hasher extends ContentHasher {
        private final Blake3 blake3 = Blake3.initHash();

        Blake3Hasher() {
            super(BLAKE3);
        }

        @Override
        protected void doUpdate(byte[] chunk, int offset, int length) {
            blake3.update(chunk, offset, length);
        }

        @Override
        protected byte[] doFinish() {
            return blake3.doFinalize(BLAKE3_LENGTH);
        }
    }

    private static final class DigestHasher extends ContentHasher {
        private final MessageDigest digest;

        DigestHasher(String algorithm, MessageDigest digest) {
            super(algorithm);
            this.digest = digest;
        }

        @Override
        protected void doUpdate(byte[] chunk, int offset, int length) {
            digest.update(chunk, offset, length);
        }

        @Override
        protected byte[] doFinish() {
            return digest.digest();
        }
    }
}
