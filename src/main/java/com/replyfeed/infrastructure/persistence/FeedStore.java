package com.replyfeed.infrastructure.persistence;

import com.replyfeed.domain.model.FeedPost;
import com.replyfeed.domain.model.Subscription;
import com.replyfeed.infrastructure.persistence.entity.FeedPostEntity;
import com.replyfeed.infrastructure.persistence.entity.SubscriptionEntity;
import com.replyfeed.infrastructure.persistence.repository.FeedPostRepository;
import com.replyfeed.infrastructure.persistence.repository.SubscriptionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Durable store for subscriptions and fanned-out feed posts.
 * 
 * Every operation is a single statement (or an existence check followed by
 * one insert) in its own transaction. Nothing here retries; callers decide.
 * 
 * Idempotency:
 * - Inserts check for an existing row first
 * - A concurrent insert that loses the race on the unique constraint is
 *   detected by re-checking and reported as "already present"
 * - Any other constraint violation propagates as {@link StorageException}
 * 
 * Error translation:
 * - Connection/transaction acquisition failures become {@link StoreUnavailableException}
 * - All other Spring data access failures become {@link StorageException}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeedStore {

    private final SubscriptionRepository subscriptionRepository;
    private final FeedPostRepository feedPostRepository;

    /**
     * @return true if a new subscription was stored, false if the user was already subscribed
     */
    public boolean addSubscription(String subscribedPostUri, String userDid, String subscriptionPostRkey) {
        return execute("add subscription", () -> {
            if (subscriptionRepository.existsBySubscribedPostUriAndUserDid(subscribedPostUri, userDid)) {
                log.debug("Subscription already exists: post={}, user={}", subscribedPostUri, userDid);
                return false;
            }

            SubscriptionEntity entity = SubscriptionEntity.builder()
                    .subscribedPostUri(subscribedPostUri)
                    .userDid(userDid)
                    .subscriptionPostRkey(subscriptionPostRkey)
                    .build();

            try {
                subscriptionRepository.saveAndFlush(entity);
                return true;
            } catch (DataIntegrityViolationException e) {
                if (subscriptionRepository.existsBySubscribedPostUriAndUserDid(subscribedPostUri, userDid)) {
                    log.debug("Concurrent duplicate subscription ignored: post={}, user={}", subscribedPostUri, userDid);
                    return false;
                }
                throw e;
            }
        });
    }

    public Set<String> getSubscribersOf(String subscribedPostUri) {
        return execute("get subscribers of post",
                () -> new LinkedHashSet<>(subscriptionRepository.findUserDidsBySubscribedPostUri(subscribedPostUri)));
    }

    /**
     * Resolve the post a subscription targets from the record key of the post that created it.
     */
    public Optional<String> findSubscription(String userDid, String subscriptionPostRkey) {
        return execute("find subscription",
                () -> subscriptionRepository.findFirstByUserDidAndSubscriptionPostRkey(userDid, subscriptionPostRkey)
                        .map(SubscriptionEntity::getSubscribedPostUri));
    }

    public Optional<Subscription> findSubscriptionById(String userDid, long id) {
        return execute("find subscription by id",
                () -> subscriptionRepository.findByIdAndUserDid(id, userDid).map(FeedStore::toSubscription));
    }

    public List<Subscription> getSubscriptionsForUser(String userDid) {
        return execute("get subscriptions for user",
                () -> subscriptionRepository.findByUserDidOrderByIdAsc(userDid).stream()
                        .map(FeedStore::toSubscription)
                        .collect(Collectors.toList()));
    }

    public void deleteSubscription(String userDid, String subscribedPostUri) {
        execute("delete subscription", () -> {
            int deleted = subscriptionRepository.deleteByUserDidAndSubscribedPostUri(userDid, subscribedPostUri);
            log.debug("Deleted {} subscription(s): post={}, user={}", deleted, subscribedPostUri, userDid);
            return deleted;
        });
    }

    /**
     * @return true if the row was inserted, false if this reply is already in the user's feed
     */
    public boolean addFeedPost(FeedPost feedPost) {
        return execute("add feed post", () -> {
            if (feedPostRepository.existsByReplyUriAndUserDid(feedPost.getReplyUri(), feedPost.getUserDid())) {
                return false;
            }

            FeedPostEntity entity = FeedPostEntity.builder()
                    .replyUri(feedPost.getReplyUri())
                    .userDid(feedPost.getUserDid())
                    .subscribedPostUri(feedPost.getSubscribedPostUri())
                    .createdAt(feedPost.getCreatedAt())
                    .build();

            try {
                feedPostRepository.saveAndFlush(entity);
                return true;
            } catch (DataIntegrityViolationException e) {
                if (feedPostRepository.existsByReplyUriAndUserDid(feedPost.getReplyUri(), feedPost.getUserDid())) {
                    return false;
                }
                throw e;
            }
        });
    }

    /**
     * Feed rows for a user older than {@code cursor}, newest first, at most {@code limit}.
     */
    public List<FeedPost> getUserFeed(String userDid, long cursor, int limit) {
        return execute("get user feed",
                () -> feedPostRepository
                        .findByUserDidAndCreatedAtLessThanOrderByCreatedAtDescIdDesc(userDid, cursor, PageRequest.of(0, limit))
                        .stream()
                        .map(FeedStore::toFeedPost)
                        .collect(Collectors.toList()));
    }

    public int deleteFeedPostsFor(String subscribedPostUri, String userDid) {
        return execute("delete feed posts", () -> {
            int deleted = feedPostRepository.deleteBySubscribedPostUriAndUserDid(subscribedPostUri, userDid);
            log.info("Deleted {} feed post(s): post={}, user={}", deleted, subscribedPostUri, userDid);
            return deleted;
        });
    }

    private <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (CannotCreateTransactionException | DataAccessResourceFailureException e) {
            throw new StoreUnavailableException(operation, e);
        } catch (DataAccessException | TransactionException e) {
            throw new StorageException(operation, e);
        }
    }

    private static Subscription toSubscription(SubscriptionEntity entity) {
        return Subscription.builder()
                .id(entity.getId())
                .subscribedPostUri(entity.getSubscribedPostUri())
                .userDid(entity.getUserDid())
                .subscriptionPostRkey(entity.getSubscriptionPostRkey())
                .build();
    }

    private static FeedPost toFeedPost(FeedPostEntity entity) {
        return FeedPost.builder()
                .id(entity.getId())
                .replyUri(entity.getReplyUri())
                .userDid(entity.getUserDid())
                .subscribedPostUri(entity.getSubscribedPostUri())
                .createdAt(entity.getCreatedAt())
                .build();
    }
}
