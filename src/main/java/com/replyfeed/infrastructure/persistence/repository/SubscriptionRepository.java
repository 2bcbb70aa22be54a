package com.replyfeed.infrastructure.persistence.repository;

import com.replyfeed.infrastructure.persistence.entity.SubscriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, Long> {

    boolean existsBySubscribedPostUriAndUserDid(String subscribedPostUri, String userDid);

    @Query("select s.userDid from SubscriptionEntity s where s.subscribedPostUri = :subscribedPostUri")
    List<String> findUserDidsBySubscribedPostUri(@Param("subscribedPostUri") String subscribedPostUri);

    Optional<SubscriptionEntity> findFirstByUserDidAndSubscriptionPostRkey(String userDid, String subscriptionPostRkey);

    Optional<SubscriptionEntity> findByIdAndUserDid(Long id, String userDid);

    List<SubscriptionEntity> findByUserDidOrderByIdAsc(String userDid);

    @Modifying
    @Transactional
    @Query("delete from SubscriptionEntity s where s.userDid = :userDid and s.subscribedPostUri = :subscribedPostUri")
    int deleteByUserDidAndSubscribedPostUri(@Param("userDid") String userDid,
                                            @Param("subscribedPostUri") String subscribedPostUri);
}
