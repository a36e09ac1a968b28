package com.libragraph.cas.core.storage;

import io.smallrye.mutiny.Uni;

/**
 * A backend-specific operation beyond the {@link Store} contract, invoked by name.
 */
@FunctionalInterface
public interface StoreCapability {

    Uni<Object> invoke(Object... args);
}
