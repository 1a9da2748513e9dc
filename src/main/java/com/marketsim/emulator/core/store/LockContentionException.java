package com.marketsim.emulator.core.store;

/**
 * A row lock could not be acquired within the configured wait. The enclosing transaction
 * is rolled back.
 */
public class LockContentionException extends RuntimeException {

    private final String rowKey;

    public LockContentionException(String rowKey, long waitedMs) {
        super("Timed out after " + waitedMs + "ms waiting for lock on " + rowKey);
        this.rowKey = rowKey;
    }

    public String getRowKey() {
        return rowKey;
    }
}
