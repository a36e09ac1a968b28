package com.libragraph.cas.core.blob;

/**
 * Options for {@link ContentAddressedStore#stream}.
 *
 * @param closeDestination close the destination once the blob has been written
 *                         (or the transfer failed)
 */
public record StreamOptions(boolean closeDestination) {

    public static StreamOptions defaults() {
        return new StreamOptions(true);
    }

    public static StreamOptions keepOpen() {
        return new StreamOptions(false);
    }
}
