package com.replyfeed.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the feed generator
 */
@Data
@ConfigurationProperties(prefix = "feedgen")
public class FeedGeneratorProperties {

    /** Directory holding the database file. */
    private String dataDir = "./data";

    private Publisher publisher = new Publisher();
    private Feed feed = new Feed();
    private Subscriptions subscriptions = new Subscriptions();
    private Jetstream jetstream = new Jetstream();
    private Http http = new Http();

    @Data
    public static class Publisher {
        private String hostName = "localhost";
        private String didBase = "did:plc:unset";
    }

    @Data
    public static class Feed {
        private String name = "bookmark-replies";
        private int defaultLimit = 50;
        private int maxLimit = 100;
    }

    @Data
    public static class Subscriptions {
        public static final String ANYONE = "*";

        private String trigger = "/subscribe";
        private List<String> allowedDids = new ArrayList<>(List.of(ANYONE));

        /**
         * Whether the given author may create or remove subscriptions through
         * firehose posts. An entry of {@code *} admits every author.
         */
        public boolean isAllowed(String authorDid) {
            if (authorDid == null || allowedDids == null) {
                return false;
            }
            return allowedDids.contains(ANYONE) || allowedDids.contains(authorDid);
        }
    }

    @Data
    public static class Jetstream {
        private boolean enabled = false;
        private String url = "wss://jetstream.atproto.tools/subscribe";
        private String collection = "app.bsky.feed.post";
        private Duration startMargin = Duration.ofMinutes(1);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration pollTimeout = Duration.ofSeconds(1);
        private Duration initialBackoff = Duration.ofSeconds(1);
        private double backoffMultiplier = 2.0;
        private Duration maxBackoff = Duration.ofSeconds(30);
        private int loudAfterAttempts = 10;
    }

    @Data
    public static class Http {
        private String requesterHeader = "X-Requester-Did";
    }
}
