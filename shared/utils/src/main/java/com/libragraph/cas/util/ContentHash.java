package com.libragraph.cas.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Digest of a blob's content.
 * Immutable value object that can be used as a map key.
 *
 * <p>Length depends on the algorithm that produced it: 16 bytes for the default
 * BLAKE3-128, 32 for SHA-256, and so on. Equality is byte-wise.
 */
public record ContentHash(byte[] bytes) {
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentHash {
        Objects.requireNonNull(bytes, "Content hash bytes cannot be null");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Content hash must not be empty");
        }
        // Defensive copy to ensure immutability
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Creates ContentHash from a lowercase or uppercase hex string.
     */
    public static ContentHash fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.isEmpty() || hex.length() % 2 != 0) {
            throw new IllegalArgumentException(
                "Hex string must have a positive even length, got: " + hex.length()
            );
        }
        try {
            return new ContentHash(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Returns lowercase hex representation (two characters per byte).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentHash other)) return false;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
