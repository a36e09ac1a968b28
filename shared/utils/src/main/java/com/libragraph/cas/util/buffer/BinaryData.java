package com.libragraph.cas.util.buffer;

import com.libragraph.cas.util.ContentHash;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.SeekableByteChannel;

/**
 * Read-only binary data backed by RAM or a disk file.
 *
 * Implements SeekableByteChannel for direct channel-based access.
 * Hash and size are always available; the hash algorithm is fixed per instance.
 */
public abstract class BinaryData implements SeekableByteChannel {

    /**
     * Content hash of this binary data.
     * May be computed lazily on first call.
     */
    public abstract ContentHash hash();

    /**
     * Total size in bytes.
     */
    public abstract long size();

    /**
     * Opens an InputStream positioned at the given offset.
     *
     * <p>The stream shares this channel's position, so only one stream
     * should be consumed at a time.
     *
     * @param pos starting position (0-based)
     * @return InputStream positioned at offset
     */
    public InputStream inputStream(long pos) {
        try {
            position(pos);
            return Channels.newInputStream(this);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create input stream at position " + pos, e);
        }
    }
}
