package com.replyfeed.domain.service;

public class UnknownFeedException extends IllegalArgumentException {

    public UnknownFeedException(String feedUri) {
        super("unknown feed: " + feedUri);
    }
}
