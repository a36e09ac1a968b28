package com.libragraph.cas.util.buffer;

import com.libragraph.cas.util.ContentHasher;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.util.Arrays;

/**
 * Buffer implementation using in-memory byte array.
 * Suitable for small blobs (&lt; 4MB).
 *
 * Supports simultaneous read/write operations with automatic growth.
 */
public class RamBuffer extends Buffer {
    private byte[] data;
    private long position;
    private long size;  // Logical size (may be less than data.length)

    public RamBuffer(int initialCapacity) {
        this(initialCapacity, ContentHasher.DEFAULT_ALGORITHM);
    }

    /**
     * Creates empty buffer with initial capacity.
     */
    public RamBuffer(int initialCapacity, String algorithm) {
        super(algorithm);
        this.data = new byte[Math.max(initialCapacity, 0)];
        this.position = 0;
        this.size = 0;
    }

    @Override
    public long size() {
        return size;
    }

    /**
     * Copy of the logical content.
     */
    public byte[] toByteArray() {
        return Arrays.copyOf(data, (int) size);
    }

    @Override
    public int read(ByteBuffer dst) throws IOException {
        if (position >= size) {
            return -1;  // EOF
        }

        int remaining = (int) (size - position);
        int toRead = Math.min(remaining, dst.remaining());
        dst.put(data, (int) position, toRead);
        position += toRead;
        return toRead;
    }

    @Override
    protected int doWrite(ByteBuffer src) throws IOException {
        int toWrite = src.remaining();
        long endPosition = position + toWrite;

        if (endPosition > data.length) {
            grow(endPosition);
        }

        src.get(data, (int) position, toWrite);
        position += toWrite;

        if (position > size) {
            size = position;
        }

        return toWrite;
    }

    @Override
    protected SeekableByteChannel doTruncate(long newSize) throws IOException {
        if (newSize < size) {
            size = newSize;
            if (position > size) {
                position = size;
            }
        }
        return this;
    }

    @Override
    public long position() throws IOException {
        return position;
    }

    @Override
    public SeekableByteChannel position(long newPosition) throws IOException {
        if (newPosition < 0) {
            throw new IllegalArgumentException("Negative position: " + newPosition);
        }
        this.position = newPosition;
        return this;
    }

    @Override
    public boolean isOpen() {
        return true;
    }

    @Override
    public void close() throws IOException {
        // nothing to release
    }

    /**
     * Doubles capacity each time to amortize growth cost.
     */
    private void grow(long minCapacity) throws IOException {
        if (minCapacity > Integer.MAX_VALUE - 8) {
            throw new IOException("RamBuffer cannot hold " + minCapacity + " bytes");
        }
        long newCapacity = Math.min(Math.max(data.length * 2L, minCapacity), Integer.MAX_VALUE - 8);
        data = Arrays.copyOf(data, (int) newCapacity);
    }
}
