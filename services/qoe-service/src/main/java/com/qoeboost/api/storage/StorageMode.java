package com.qoeboost.api.storage;

/**
 * Which backing store serves this process. Decided once by StorageProbe at
 * startup and never revisited.
 */
public enum StorageMode {

    /** PostgreSQL via JPA; data survives restarts. */
    DURABLE,

    /**
     * In-process store; data is lost on restart and user references are
     * checked best-effort only. Responses served from it are marked degraded.
     */
    FALLBACK;

    public boolean isDegraded() {
        return this == FALLBACK;
    }
}
