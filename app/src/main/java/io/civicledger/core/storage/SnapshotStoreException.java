package io.civicledger.core.storage;

public class SnapshotStoreException extends RuntimeException {
    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
