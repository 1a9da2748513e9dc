package com.marketsim.emulator.core.store;

/**
 * Transient persistence failure. The core treats it as "skip this write, retry next tick".
 */
public class StorageUnavailableException extends RuntimeException {

    public StorageUnavailableException(String message) {
        super(message);
    }

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
