package com.replyfeed.infrastructure.persistence.repository;

import com.replyfeed.infrastructure.persistence.entity.FeedPostEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface FeedPostRepository extends JpaRepository<FeedPostEntity, Long> {

    boolean existsByReplyUriAndUserDid(String replyUri, String userDid);

    /**
     * Newest-first page of a user's feed strictly older than the cursor.
     * 
     * Ties on createdAt are broken by id so paging is stable.
     */
    List<FeedPostEntity> findByUserDidAndCreatedAtLessThanOrderByCreatedAtDescIdDesc(
            String userDid, long createdAtBefore, Pageable pageable);

    @Modifying
    @Transactional
    @Query("delete from FeedPostEntity f where f.subscribedPostUri = :subscribedPostUri and f.userDid = :userDid")
    int deleteBySubscribedPostUriAndUserDid(@Param("subscribedPostUri") String subscribedPostUri,
                                            @Param("userDid") String userDid);
}
