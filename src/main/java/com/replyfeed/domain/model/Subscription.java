package com.replyfeed.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's standing request to see replies to one post.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Subscription {

    private Long id;
    private String subscribedPostUri;
    private String userDid;

    /** Record key of the post that created the subscription; null when created over HTTP. */
    private String subscriptionPostRkey;
}
