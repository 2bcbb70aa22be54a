package com.replyfeed;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Reply Subscription Feed Generator
 * 
 * Watches the Jetstream firehose for replies to posts that users have
 * subscribed to and serves them back as a personal feed.
 * 
 * Architecture:
 * - Jetstream WebSocket ingestion (single sequential consumer)
 * - Store-backed subscription state machine (no in-memory registry)
 * - Idempotent fan-out (unique constraint on reply + recipient)
 * - Ordered unsubscribe (feed rows first, then the subscription)
 * - Cursor-paginated feed skeleton over HTTP
 */
@SpringBootApplication
@EnableTransactionManagement
public class ReplyFeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReplyFeedApplication.class, args);
    }
}
