package com.replyfeed.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * Domain model representing a single commit observed on the firehose.
 * 
 * This is the input event that drives the subscription state machine.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FirehoseEvent {

    private String authorDid;
    private Operation operation;
    private String collection;
    private String recordKey;

    /** Raw record body, present on creates. May not be a post at all. */
    private JsonNode record;

    /** RFC3339 time the firehose observed the event, if known. */
    private String timestamp;

    /** Firehose cursor (microseconds since epoch) to resume after this event. */
    private Long cursor;

    public enum Operation {
        CREATE,
        UPDATE,
        DELETE,
        OTHER;

        public static Operation fromWire(String value) {
            if (value == null) {
                return OTHER;
            }
            switch (value.toLowerCase(Locale.ROOT)) {
                case "create":
                    return CREATE;
                case "update":
                    return UPDATE;
                case "delete":
                    return DELETE;
                default:
                    return OTHER;
            }
        }
    }
}
