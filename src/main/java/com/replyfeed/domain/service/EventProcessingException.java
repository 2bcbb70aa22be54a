package com.replyfeed.domain.service;

/**
 * A firehose event could not be applied to the store.
 * 
 * The message names what was being attempted; the cause is kept for logging.
 * {@link #isStoreUnavailable()} tells the ingestion loop that no further
 * events can be processed until the store is reachable again.
 */
public class EventProcessingException extends RuntimeException {

    private final boolean storeUnavailable;

    public EventProcessingException(String message, Throwable cause, boolean storeUnavailable) {
        super(message, cause);
        this.storeUnavailable = storeUnavailable;
    }

    public boolean isStoreUnavailable() {
        return storeUnavailable;
    }
}
