package com.replyfeed.domain.service;

import com.replyfeed.domain.model.Subscription;
import com.replyfeed.infrastructure.persistence.FeedStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Subscription management for the HTTP API.
 * 
 * Firehose-driven subscriptions go through {@link FirehoseEventHandler}; this
 * service covers the same registry for signed-in users managing their list.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final FeedStore feedStore;

    public List<Subscription> listSubscriptions(String userDid) {
        return feedStore.getSubscriptionsForUser(userDid);
    }

    /**
     * @return true if a new subscription was created
     */
    public boolean subscribe(String userDid, String subscribedPostUri, String subscriptionPostRkey) {
        if (subscribedPostUri == null || !subscribedPostUri.startsWith("at://")) {
            throw new IllegalArgumentException("subscribed post URI must be an at:// URI");
        }
        boolean created = feedStore.addSubscription(subscribedPostUri, userDid, subscriptionPostRkey);
        log.info("Subscription via API: user={}, subscribedPostUri={}, created={}", userDid, subscribedPostUri, created);
        return created;
    }

    /**
     * Remove one of the user's subscriptions and the replies it collected.
     * Same order as the firehose delete: feed rows, then the subscription.
     */
    public void unsubscribe(String userDid, long subscriptionId) {
        Subscription subscription = feedStore.findSubscriptionById(userDid, subscriptionId)
                .orElseThrow(() -> new SubscriptionNotFoundException(subscriptionId));

        feedStore.deleteFeedPostsFor(subscription.getSubscribedPostUri(), userDid);
        feedStore.deleteSubscription(userDid, subscription.getSubscribedPostUri());

        log.info("Subscription {} removed via API for {}", subscriptionId, userDid);
    }
}
