package com.replyfeed.infrastructure.persistence;

/**
 * The database could not be reached at all (no connection, no transaction).
 */
public class StoreUnavailableException extends StorageException {

    public StoreUnavailableException(String operation, Throwable cause) {
        super(operation, cause);
    }
}
