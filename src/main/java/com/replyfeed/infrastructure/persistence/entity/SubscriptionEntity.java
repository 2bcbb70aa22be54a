package com.replyfeed.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Entity representing a reply subscription.
 * 
 * A user holds at most one subscription per target post; the unique
 * constraint on (subscribed_post_uri, user_did) enforces this at database
 * level so that duplicate subscribe events collapse into a no-op.
 */
@Entity
@Table(name = "subscriptions",
    uniqueConstraints = {
        @UniqueConstraint(name = "uq_subscription_post_user", columnNames = {"subscribed_post_uri", "user_did"})
    },
    indexes = {
        @Index(name = "idx_subscription_user_rkey", columnList = "user_did,subscription_post_rkey")
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "subscribed_post_uri", nullable = false, length = 512)
    private String subscribedPostUri;

    @Column(name = "user_did", nullable = false, length = 255)
    private String userDid;

    @Column(name = "subscription_post_rkey", length = 128)
    private String subscriptionPostRkey;
}
