package com.replyfeed.infrastructure.messaging;

import java.time.Duration;

/**
 * One live connection to Jetstream, read by a single consumer thread.
 */
public interface JetstreamSession extends AutoCloseable {

    /**
     * Wait for the next text frame.
     *
     * @return the frame, or {@code null} if nothing arrived within the timeout
     * @throws JetstreamDisconnectedException once the connection is gone
     */
    String poll(Duration timeout) throws InterruptedException;

    @Override
    void close();
}
