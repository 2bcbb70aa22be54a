package com.replyfeed.domain.model;

/**
 * Outcome of handling one firehose event.
 */
public enum Transition {
    IGNORE,
    SUBSCRIBE,
    FAN_OUT,
    UNSUBSCRIBE
}
