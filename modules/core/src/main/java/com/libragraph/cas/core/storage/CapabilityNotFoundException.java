package com.libragraph.cas.core.storage;

/**
 * Thrown when a named capability is invoked on a store that does not offer it.
 */
public class CapabilityNotFoundException extends StorageException {

    private final String capability;

    public CapabilityNotFoundException(String capability, Store store) {
        super("Capability not found: " + capability + " on " + store.getClass().getSimpleName());
        this.capability = capability;
    }

    public String capability() {
        return capability;
    }
}
