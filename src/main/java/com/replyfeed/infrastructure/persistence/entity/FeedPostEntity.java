package com.replyfeed.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity representing one reply fanned out into one subscriber's feed.
 * 
 * Unique on (reply_uri, user_did): redelivered firehose events insert
 * nothing new.
 */
@Entity
@Table(name = "feed_posts",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_feed_post_reply_user", columnNames = {"reply_uri", "user_did"})
    },
    indexes = {
        @Index(name = "idx_feed_user_created", columnList = "user_did,created_at"),
        @Index(name = "idx_feed_subscribed_user", columnList = "subscribed_post_uri,user_did")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedPostEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "reply_uri", nullable = false, length = 512)
    private String replyUri;

    @Column(name = "user_did", nullable = false, length = 255)
    private String userDid;

    @Column(name = "subscribed_post_uri", nullable = false, length = 512)
    private String subscribedPostUri;

    @Column(name = "created_at", nullable = false)
    private long createdAt;
}
