/**
 * Shared utilities for all CAS modules.
 *
 * <p>Contains {@link com.libragraph.cas.util.ContentHash}, the incremental
 * {@link com.libragraph.cas.util.ContentHasher} (BLAKE3-128 by default) and the
 * {@link com.libragraph.cas.util.buffer buffer layer} (BinaryData, Buffer, RamBuffer, FileBuffer).
 * No framework dependencies: pure Java plus commons-codec.
 */
package com.libragraph.cas.util;
