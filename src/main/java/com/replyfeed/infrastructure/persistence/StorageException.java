package com.replyfeed.infrastructure.persistence;

/**
 * Raised when a store operation fails for any reason other than the
 * intentional duplicate no-op.
 */
public class StorageException extends RuntimeException {

    private final String operation;

    public StorageException(String operation, Throwable cause) {
        super("store operation failed: " + operation, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
