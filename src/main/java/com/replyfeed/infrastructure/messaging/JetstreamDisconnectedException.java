package com.replyfeed.infrastructure.messaging;

public class JetstreamDisconnectedException extends RuntimeException {

    public JetstreamDisconnectedException(String message) {
        super(message);
    }

    public JetstreamDisconnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
