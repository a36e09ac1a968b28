package com.libragraph.cas.core.blob;

import java.util.UUID;

/**
 * Maps a {@link KeyRequest} to a storage key.
 *
 * <p>Called twice per put: once without a hash for the temporary key, once with
 * the hash for the final key. Must be deterministic for a given hash and metadata,
 * otherwise identical content would not collapse onto one key.
 */
@FunctionalInterface
public interface KeyDerivation {

    String TEMPORARY_PREFIX = "tmp/";

    String deriveKey(KeyRequest request);

    /**
     * {@code tmp/<uuid>} while temporary, the hex hash once final.
     * With {@code keepExtension}, the metadata extension is appended to both.
     */
    static KeyDerivation defaults(boolean keepExtension) {
        return request -> {
            String suffix = keepExtension ? request.meta().extension().orElse("") : "";
            if (request.isTemporary()) {
                return TEMPORARY_PREFIX + UUID.randomUUID() + suffix;
            }
            return request.hash().toHex() + suffix;
        };
    }
}
