package com.replyfeed.infrastructure.messaging;

/**
 * Opens streaming sessions against a Jetstream endpoint.
 */
public interface JetstreamConnector {

    /**
     * Connect and start streaming from the given cursor.
     *
     * @param cursorMicros replay position, microseconds since the epoch
     * @throws JetstreamDisconnectedException if the connection cannot be established
     */
    JetstreamSession open(long cursorMicros);
}
