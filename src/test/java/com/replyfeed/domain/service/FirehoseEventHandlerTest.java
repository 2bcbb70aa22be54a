package com.replyfeed.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.replyfeed.config.FeedGeneratorProperties;
import com.replyfeed.domain.model.FeedPost;
import com.replyfeed.domain.model.FirehoseEvent;
import com.replyfeed.domain.model.PostRecord;
import com.replyfeed.domain.model.Transition;
import com.replyfeed.infrastructure.persistence.FeedStore;
import com.replyfeed.infrastructure.persistence.StorageException;
import com.replyfeed.infrastructure.persistence.StoreUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FirehoseEventHandlerTest {

    private static final String SUBSCRIBED_POST = "at://did:plc:target/app.bsky.feed.post/p1";
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @Mock private FeedStore feedStore;

    private MeterRegistry meterRegistry;
    private ObjectMapper objectMapper;
    private FeedGeneratorProperties properties;
    private FirehoseEventHandler handler;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new ObjectMapper();
        properties = new FeedGeneratorProperties();

        handler = new FirehoseEventHandler(
                feedStore,
                objectMapper,
                meterRegistry,
                Clock.fixed(NOW, ZoneOffset.UTC),
                properties
        );
    }

    @Test
    void handle_subscribePost_addsSubscription() {
        when(feedStore.addSubscription(SUBSCRIBED_POST, "did:plc:alice", "sub1")).thenReturn(true);

        Transition result = handler.handle(createEvent("did:plc:alice", "sub1", "/subscribe", SUBSCRIBED_POST, null));

        assertEquals(Transition.SUBSCRIBE, result);
        verify(feedStore).addSubscription(SUBSCRIBED_POST, "did:plc:alice", "sub1");
        verify(feedStore, never()).getSubscribersOf(anyString());
    }

    @Test
    void handle_duplicateSubscribe_isNoOp() {
        when(feedStore.addSubscription(SUBSCRIBED_POST, "did:plc:alice", "sub1")).thenReturn(true, false);
        FirehoseEvent event = createEvent("did:plc:alice", "sub1", "please /subscribe", SUBSCRIBED_POST, null);

        assertEquals(Transition.SUBSCRIBE, handler.handle(event));
        assertEquals(Transition.SUBSCRIBE, handler.handle(event));

        verify(feedStore, times(2)).addSubscription(SUBSCRIBED_POST, "did:plc:alice", "sub1");
    }

    @Test
    void handle_subscribeFromAuthorNotOnAllowList_isIgnored() {
        properties.getSubscriptions().setAllowedDids(List.of("did:plc:operator"));

        Transition result = handler.handle(createEvent("did:plc:alice", "sub1", "/subscribe", SUBSCRIBED_POST, null));

        assertEquals(Transition.IGNORE, result);
        verifyNoInteractions(feedStore);
    }

    @Test
    void handle_subscribeFromAllowListedAuthor_addsSubscription() {
        properties.getSubscriptions().setAllowedDids(List.of("did:plc:operator"));
        when(feedStore.addSubscription(SUBSCRIBED_POST, "did:plc:operator", "sub1")).thenReturn(true);

        Transition result = handler.handle(createEvent("did:plc:operator", "sub1", "/subscribe", SUBSCRIBED_POST, null));

        assertEquals(Transition.SUBSCRIBE, result);
    }

    @Test
    void handle_subscribeWhenStoreFails_throwsWithContext() {
        when(feedStore.addSubscription(anyString(), anyString(), anyString()))
                .thenThrow(new StorageException("add subscription", new RuntimeException("disk full")));

        EventProcessingException e = assertThrows(EventProcessingException.class,
                () -> handler.handle(createEvent("did:plc:alice", "sub1", "/subscribe", SUBSCRIBED_POST, null)));

        assertFalse(e.isStoreUnavailable());
        assertTrue(e.getMessage().contains("add subscription"));
        assertTrue(e.getMessage().contains("did:plc:alice"));
        assertInstanceOf(StorageException.class, e.getCause());
    }

    @Test
    void handle_subscribeWhenStoreUnreachable_flagsUnavailable() {
        when(feedStore.addSubscription(anyString(), anyString(), anyString()))
                .thenThrow(new StoreUnavailableException("add subscription", new RuntimeException("connection refused")));

        EventProcessingException e = assertThrows(EventProcessingException.class,
                () -> handler.handle(createEvent("did:plc:alice", "sub1", "/subscribe", SUBSCRIBED_POST, null)));

        assertTrue(e.isStoreUnavailable());
    }

    @Test
    void handle_replyToSubscribedPost_fansOutToEverySubscriber() {
        when(feedStore.getSubscribersOf(SUBSCRIBED_POST)).thenReturn(subscribers("did:plc:alice", "did:plc:bob"));
        when(feedStore.addFeedPost(any(FeedPost.class))).thenReturn(true);

        Transition result = handler.handle(
                createEvent("did:plc:replier", "r1", "nice post", SUBSCRIBED_POST, "2024-04-30T08:15:00.000Z"));

        assertEquals(Transition.FAN_OUT, result);

        ArgumentCaptor<FeedPost> captor = ArgumentCaptor.forClass(FeedPost.class);
        verify(feedStore, times(2)).addFeedPost(captor.capture());

        List<FeedPost> written = captor.getAllValues();
        assertEquals(Set.of("did:plc:alice", "did:plc:bob"),
                written.stream().map(FeedPost::getUserDid).collect(Collectors.toSet()));
        for (FeedPost feedPost : written) {
            assertEquals("at://did:plc:replier/app.bsky.feed.post/r1", feedPost.getReplyUri());
            assertEquals(SUBSCRIBED_POST, feedPost.getSubscribedPostUri());
            assertEquals(Instant.parse("2024-04-30T08:15:00Z").toEpochMilli(), feedPost.getCreatedAt());
        }
        assertEquals(2.0, meterRegistry.counter("feedgen.fanout.rows").count());
    }

    @Test
    void handle_replyWithoutSubscribers_writesNothing() {
        when(feedStore.getSubscribersOf(SUBSCRIBED_POST)).thenReturn(Set.of());

        Transition result = handler.handle(createEvent("did:plc:replier", "r1", "hello", SUBSCRIBED_POST, null));

        assertEquals(Transition.FAN_OUT, result);
        verify(feedStore, never()).addFeedPost(any());
    }

    @Test
    void handle_fanOutFailureForOneSubscriber_stillWritesTheOthers() {
        when(feedStore.getSubscribersOf(SUBSCRIBED_POST))
                .thenReturn(subscribers("did:plc:alice", "did:plc:bob", "did:plc:carol"));
        when(feedStore.addFeedPost(any(FeedPost.class))).thenAnswer(invocation -> {
            FeedPost feedPost = invocation.getArgument(0);
            if ("did:plc:bob".equals(feedPost.getUserDid())) {
                throw new StorageException("add feed post", new RuntimeException("constraint"));
            }
            return true;
        });

        Transition result = handler.handle(createEvent("did:plc:replier", "r1", "hello", SUBSCRIBED_POST, null));

        assertEquals(Transition.FAN_OUT, result);
        verify(feedStore, times(3)).addFeedPost(any(FeedPost.class));
        assertEquals(1.0, meterRegistry.counter("feedgen.fanout.failures").count());
        assertEquals(2.0, meterRegistry.counter("feedgen.fanout.rows").count());
    }

    @Test
    void handle_subscriberLookupFails_treatedAsNoSubscribers() {
        when(feedStore.getSubscribersOf(SUBSCRIBED_POST))
                .thenThrow(new StorageException("get subscribers of post", new RuntimeException("bad query")));

        Transition result = handler.handle(createEvent("did:plc:replier", "r1", "hello", SUBSCRIBED_POST, null));

        assertEquals(Transition.FAN_OUT, result);
        verify(feedStore, never()).addFeedPost(any());
    }

    @Test
    void handle_subscriberLookupWhenStoreUnreachable_throws() {
        when(feedStore.getSubscribersOf(SUBSCRIBED_POST))
                .thenThrow(new StoreUnavailableException("get subscribers of post", new RuntimeException("refused")));

        EventProcessingException e = assertThrows(EventProcessingException.class,
                () -> handler.handle(createEvent("did:plc:replier", "r1", "hello", SUBSCRIBED_POST, null)));

        assertTrue(e.isStoreUnavailable());
    }

    @Test
    void handle_replyWithUnparseableCreatedAt_usesEventTimestamp() {
        when(feedStore.getSubscribersOf(SUBSCRIBED_POST)).thenReturn(subscribers("did:plc:alice"));
        when(feedStore.addFeedPost(any(FeedPost.class))).thenReturn(true);

        FirehoseEvent event = createEvent("did:plc:replier", "r1", "hello", SUBSCRIBED_POST, "yesterday-ish");
        event.setTimestamp("2024-04-30T10:00:00Z");

        handler.handle(event);

        ArgumentCaptor<FeedPost> captor = ArgumentCaptor.forClass(FeedPost.class);
        verify(feedStore).addFeedPost(captor.capture());
        assertEquals(Instant.parse("2024-04-30T10:00:00Z").toEpochMilli(), captor.getValue().getCreatedAt());
    }

    @Test
    void handle_replyWithoutAnyTimestamp_usesClock() {
        when(feedStore.getSubscribersOf(SUBSCRIBED_POST)).thenReturn(subscribers("did:plc:alice"));
        when(feedStore.addFeedPost(any(FeedPost.class))).thenReturn(true);

        handler.handle(createEvent("did:plc:replier", "r1", "hello", SUBSCRIBED_POST, null));

        ArgumentCaptor<FeedPost> captor = ArgumentCaptor.forClass(FeedPost.class);
        verify(feedStore).addFeedPost(captor.capture());
        assertEquals(NOW.toEpochMilli(), captor.getValue().getCreatedAt());
    }

    @Test
    void handle_deleteOfSubscribingPost_removesFeedRowsBeforeSubscription() {
        when(feedStore.findSubscription("did:plc:alice", "sub1")).thenReturn(Optional.of(SUBSCRIBED_POST));

        Transition result = handler.handle(deleteEvent("did:plc:alice", "sub1"));

        assertEquals(Transition.UNSUBSCRIBE, result);
        InOrder inOrder = inOrder(feedStore);
        inOrder.verify(feedStore).findSubscription("did:plc:alice", "sub1");
        inOrder.verify(feedStore).deleteFeedPostsFor(SUBSCRIBED_POST, "did:plc:alice");
        inOrder.verify(feedStore).deleteSubscription("did:plc:alice", SUBSCRIBED_POST);
    }

    @Test
    void handle_deleteOfUnknownPost_isNoOp() {
        when(feedStore.findSubscription("did:plc:alice", "some-other-post")).thenReturn(Optional.empty());

        Transition result = handler.handle(deleteEvent("did:plc:alice", "some-other-post"));

        assertEquals(Transition.IGNORE, result);
        verify(feedStore, never()).deleteFeedPostsFor(anyString(), anyString());
        verify(feedStore, never()).deleteSubscription(anyString(), anyString());
    }

    @Test
    void handle_deleteWhenFeedCleanupFails_keepsSubscription() {
        when(feedStore.findSubscription("did:plc:alice", "sub1")).thenReturn(Optional.of(SUBSCRIBED_POST));
        when(feedStore.deleteFeedPostsFor(SUBSCRIBED_POST, "did:plc:alice"))
                .thenThrow(new StorageException("delete feed posts", new RuntimeException("locked")));

        EventProcessingException e = assertThrows(EventProcessingException.class,
                () -> handler.handle(deleteEvent("did:plc:alice", "sub1")));

        assertTrue(e.getMessage().contains("delete feed posts"));
        verify(feedStore, never()).deleteSubscription(anyString(), anyString());
    }

    @Test
    void handle_deleteFromAuthorNotOnAllowList_isIgnored() {
        properties.getSubscriptions().setAllowedDids(List.of("did:plc:operator"));

        Transition result = handler.handle(deleteEvent("did:plc:alice", "sub1"));

        assertEquals(Transition.IGNORE, result);
        verifyNoInteractions(feedStore);
    }

    @Test
    void handle_irrelevantEvents_areIgnoredWithoutTouchingTheStore() {
        FirehoseEvent update = createEvent("did:plc:alice", "sub1", "/subscribe", SUBSCRIBED_POST, null);
        update.setOperation(FirehoseEvent.Operation.UPDATE);

        FirehoseEvent like = createEvent("did:plc:alice", "l1", "", SUBSCRIBED_POST, null);
        like.setCollection("app.bsky.feed.like");

        FirehoseEvent notAReply = createEvent("did:plc:alice", "p2", "just posting", null, null);

        FirehoseEvent garbage = createEvent("did:plc:alice", "p3", "", SUBSCRIBED_POST, null);
        garbage.setRecord(TextNode.valueOf("not an object"));

        FirehoseEvent wrongShape = createEvent("did:plc:alice", "p4", "", SUBSCRIBED_POST, null);
        wrongShape.setRecord(objectMapper.createObjectNode().put("reply", "should be an object"));

        FirehoseEvent other = FirehoseEvent.builder()
                .authorDid("did:plc:alice")
                .operation(FirehoseEvent.Operation.OTHER)
                .collection("app.bsky.feed.post")
                .recordKey("p5")
                .build();

        for (FirehoseEvent event : List.of(update, like, notAReply, garbage, wrongShape, other)) {
            assertEquals(Transition.IGNORE, handler.handle(event));
        }
        verifyNoInteractions(feedStore);
    }

    @Test
    void handle_deleteWithoutRecordKey_neverTouchesSubscriptions() {
        Transition result = handler.handle(deleteEvent("did:plc:alice", null));

        assertEquals(Transition.IGNORE, result);
        verifyNoInteractions(feedStore);
    }

    @Test
    void handle_replyWithoutAuthorOrRecordKey_isNotFannedOut() {
        List<FirehoseEvent> events = List.of(
                createEvent(null, "r1", "hello", SUBSCRIBED_POST, null),
                createEvent("did:plc:replier", null, "hello", SUBSCRIBED_POST, null),
                createEvent(" ", "", "hello", SUBSCRIBED_POST, null),
                createEvent(null, "sub1", "/subscribe", SUBSCRIBED_POST, null));

        for (FirehoseEvent event : events) {
            assertEquals(Transition.IGNORE, handler.handle(event));
        }
        verifyNoInteractions(feedStore);
    }

    private FirehoseEvent createEvent(String author, String rkey, String text, String parentUri, String createdAt) {
        PostRecord.PostRecordBuilder post = PostRecord.builder()
                .text(text)
                .createdAt(createdAt);
        if (parentUri != null) {
            post.reply(PostRecord.ReplyRef.builder()
                    .root(PostRecord.StrongRef.builder().uri(parentUri).build())
                    .parent(PostRecord.StrongRef.builder().uri(parentUri).build())
                    .build());
        }

        return FirehoseEvent.builder()
                .authorDid(author)
                .operation(FirehoseEvent.Operation.CREATE)
                .collection("app.bsky.feed.post")
                .recordKey(rkey)
                .record(objectMapper.valueToTree(post.build()))
                .build();
    }

    private FirehoseEvent deleteEvent(String author, String rkey) {
        return FirehoseEvent.builder()
                .authorDid(author)
                .operation(FirehoseEvent.Operation.DELETE)
                .collection("app.bsky.feed.post")
                .recordKey(rkey)
                .build();
    }

    private static Set<String> subscribers(String... dids) {
        return new LinkedHashSet<>(List.of(dids));
    }
}
