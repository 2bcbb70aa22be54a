package com.replyfeed.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One reply delivered into one subscriber's feed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedPost {

    private Long id;
    private String replyUri;
    private String userDid;
    private String subscribedPostUri;

    /** Epoch milliseconds; the feed's sort and cursor key. */
    private long createdAt;
}
