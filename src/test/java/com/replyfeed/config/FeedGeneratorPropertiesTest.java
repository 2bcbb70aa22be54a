package com.replyfeed.config;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedGeneratorPropertiesTest {

    @Test
    void isAllowed_defaultAdmitsEveryone() {
        FeedGeneratorProperties.Subscriptions subscriptions = new FeedGeneratorProperties.Subscriptions();

        assertTrue(subscriptions.isAllowed("did:plc:anyone"));
        assertFalse(subscriptions.isAllowed(null));
    }

    @Test
    void isAllowed_explicitListAdmitsOnlyListedAuthors() {
        FeedGeneratorProperties.Subscriptions subscriptions = new FeedGeneratorProperties.Subscriptions();
        subscriptions.setAllowedDids(List.of("did:plc:operator", "did:plc:friend"));

        assertTrue(subscriptions.isAllowed("did:plc:friend"));
        assertFalse(subscriptions.isAllowed("did:plc:stranger"));
    }

    @Test
    void isAllowed_emptyListAdmitsNobody() {
        FeedGeneratorProperties.Subscriptions subscriptions = new FeedGeneratorProperties.Subscriptions();
        subscriptions.setAllowedDids(List.of());

        assertFalse(subscriptions.isAllowed("did:plc:operator"));
    }
}
