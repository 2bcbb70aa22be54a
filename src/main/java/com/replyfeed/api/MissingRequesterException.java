package com.replyfeed.api;

public class MissingRequesterException extends RuntimeException {

    public MissingRequesterException() {
        super("missing authenticated user");
    }
}
