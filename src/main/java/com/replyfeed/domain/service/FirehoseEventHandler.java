package com.replyfeed.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.replyfeed.config.FeedGeneratorProperties;
import com.replyfeed.domain.model.FeedPost;
import com.replyfeed.domain.model.FirehoseEvent;
import com.replyfeed.domain.model.PostRecord;
import com.replyfeed.domain.model.Transition;
import com.replyfeed.infrastructure.persistence.FeedStore;
import com.replyfeed.infrastructure.persistence.StorageException;
import com.replyfeed.infrastructure.persistence.StoreUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Optional;
import java.util.Set;

/**
 * Applies firehose events to the subscription registry.
 * 
 * Transitions:
 * 1. Ignore      - not a post create/delete, missing author or rkey, undecodable
 *                  record, not a reply, or a subscription change from an author
 *                  not on the allow-list
 * 2. Subscribe   - reply containing the trigger marker: store (parent, author, rkey)
 * 3. Fan-out     - any other reply: one feed row per subscriber of the parent
 * 4. Unsubscribe - delete of a subscribing post: feed rows first, then the subscription
 * 
 * The handler keeps no state of its own; everything lives in {@link FeedStore}.
 * It is called from a single sequential consumer and needs no locking.
 * 
 * Failure Handling:
 * - Subscribe/unsubscribe store failures: thrown as {@link EventProcessingException}
 * - Fan-out failures: logged and counted per subscriber, never thrown
 * - Store unreachable while looking up subscribers: thrown, so ingestion can back off
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FirehoseEventHandler {

    static final String POST_COLLECTION = "app.bsky.feed.post";

    private final FeedStore feedStore;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final FeedGeneratorProperties properties;

    public Transition handle(FirehoseEvent event) {
        Transition transition = Transition.IGNORE;

        if (isAddressable(event) && POST_COLLECTION.equals(event.getCollection())) {
            switch (event.getOperation()) {
                case CREATE:
                    transition = handleCreate(event);
                    break;
                case DELETE:
                    transition = handleDelete(event);
                    break;
                default:
                    break;
            }
        }

        Counter.builder("feedgen.events.handled")
                .tag("transition", transition.name())
                .register(meterRegistry)
                .increment();

        return transition;
    }

    /**
     * Events without an author and record key can neither be traced back to a
     * subscription nor turned into a reply URI.
     */
    private static boolean isAddressable(FirehoseEvent event) {
        return event != null
                && event.getOperation() != null
                && event.getAuthorDid() != null && !event.getAuthorDid().isBlank()
                && event.getRecordKey() != null && !event.getRecordKey().isBlank();
    }

    private Transition handleCreate(FirehoseEvent event) {
        Optional<PostRecord> decoded = decodePost(event);
        if (decoded.isEmpty()) {
            return Transition.IGNORE;
        }

        PostRecord post = decoded.get();

        // only replies matter, either as subscriptions or as feed items
        Optional<String> parentUri = post.replyParentUri();
        if (parentUri.isEmpty()) {
            return Transition.IGNORE;
        }

        if (post.containsMarker(properties.getSubscriptions().getTrigger())) {
            if (!properties.getSubscriptions().isAllowed(event.getAuthorDid())) {
                log.debug("Ignoring subscribe post from author not on the allow-list: {}", event.getAuthorDid());
                return Transition.IGNORE;
            }
            return subscribe(event, parentUri.get());
        }

        fanOut(event, post, parentUri.get());
        return Transition.FAN_OUT;
    }

    private Transition subscribe(FirehoseEvent event, String subscribedPostUri) {
        log.info("Subscribe post received: author={}, subscribedPostUri={}, rkey={}",
                event.getAuthorDid(), subscribedPostUri, event.getRecordKey());

        try {
            boolean created = feedStore.addSubscription(subscribedPostUri, event.getAuthorDid(), event.getRecordKey());
            if (!created) {
                log.info("Author {} already subscribed to {}", event.getAuthorDid(), subscribedPostUri);
            }
        } catch (StorageException e) {
            throw failure("add subscription", event, e);
        }
        return Transition.SUBSCRIBE;
    }

    private void fanOut(FirehoseEvent event, PostRecord post, String subscribedPostUri) {
        Set<String> subscribers = subscribersOf(event, subscribedPostUri);
        if (subscribers.isEmpty()) {
            return;
        }

        String replyUri = replyUri(event);
        long createdAt = resolveCreatedAt(post, event);

        log.info("Reply to subscribed post: subscribedPostUri={}, replyUri={}, subscribers={}",
                subscribedPostUri, replyUri, subscribers.size());

        for (String subscriber : subscribers) {
            FeedPost feedPost = FeedPost.builder()
                    .replyUri(replyUri)
                    .userDid(subscriber)
                    .subscribedPostUri(subscribedPostUri)
                    .createdAt(createdAt)
                    .build();
            try {
                if (feedStore.addFeedPost(feedPost)) {
                    meterRegistry.counter("feedgen.fanout.rows").increment();
                }
            } catch (StorageException e) {
                log.error("Failed to add reply {} to feed of {}: {}", replyUri, subscriber, e.getMessage(), e);
                meterRegistry.counter("feedgen.fanout.failures").increment();
            }
        }
    }

    private Set<String> subscribersOf(FirehoseEvent event, String subscribedPostUri) {
        try {
            return feedStore.getSubscribersOf(subscribedPostUri);
        } catch (StoreUnavailableException e) {
            throw failure("look up subscribers", event, e);
        } catch (StorageException e) {
            log.error("Failed to look up subscribers of {}: {}", subscribedPostUri, e.getMessage(), e);
            meterRegistry.counter("feedgen.fanout.failures").increment();
            return Collections.emptySet();
        }
    }

    private Transition handleDelete(FirehoseEvent event) {
        if (!properties.getSubscriptions().isAllowed(event.getAuthorDid())) {
            return Transition.IGNORE;
        }

        Optional<String> subscribedPostUri;
        try {
            subscribedPostUri = feedStore.findSubscription(event.getAuthorDid(), event.getRecordKey());
        } catch (StorageException e) {
            throw failure("resolve subscription", event, e);
        }

        if (subscribedPostUri.isEmpty()) {
            return Transition.IGNORE;
        }

        log.info("Unsubscribing: author={}, subscribedPostUri={}, rkey={}",
                event.getAuthorDid(), subscribedPostUri.get(), event.getRecordKey());

        // Feed rows go first. If the second step fails the subscription is
        // still there, so a redelivered delete can finish the job.
        try {
            feedStore.deleteFeedPostsFor(subscribedPostUri.get(), event.getAuthorDid());
        } catch (StorageException e) {
            throw failure("delete feed posts", event, e);
        }

        try {
            feedStore.deleteSubscription(event.getAuthorDid(), subscribedPostUri.get());
        } catch (StorageException e) {
            throw failure("delete subscription", event, e);
        }

        return Transition.UNSUBSCRIBE;
    }

    private Optional<PostRecord> decodePost(FirehoseEvent event) {
        if (event.getRecord() == null || !event.getRecord().isObject()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.treeToValue(event.getRecord(), PostRecord.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            // firehose noise, not a failure
            log.debug("Ignoring undecodable post record from {}: {}", event.getAuthorDid(), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Post's own createdAt, else the firehose timestamp, else now.
     */
    long resolveCreatedAt(PostRecord post, FirehoseEvent event) {
        return parseTimestamp(post.getCreatedAt())
                .or(() -> parseTimestamp(event.getTimestamp()))
                .orElseGet(clock::instant)
                .toEpochMilli();
    }

    private Optional<Instant> parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            log.debug("Unparseable timestamp '{}'", value);
            return Optional.empty();
        }
    }

    static String replyUri(FirehoseEvent event) {
        return String.format("at://%s/%s/%s", event.getAuthorDid(), POST_COLLECTION, event.getRecordKey());
    }

    private EventProcessingException failure(String action, FirehoseEvent event, StorageException cause) {
        String message = String.format("failed to %s for author=%s rkey=%s",
                action, event.getAuthorDid(), event.getRecordKey());
        return new EventProcessingException(message, cause, cause instanceof StoreUnavailableException);
    }
}
