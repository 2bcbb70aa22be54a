package com.replyfeed.domain.service;

public class SubscriptionNotFoundException extends RuntimeException {

    public SubscriptionNotFoundException(long id) {
        super("subscription not found: " + id);
    }
}
