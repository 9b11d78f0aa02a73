package com.newsrelay.repository;

import com.newsrelay.model.SubscriptionEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface SubscriptionRepository extends JpaRepository<SubscriptionEntity, Long> {

    Optional<SubscriptionEntity> findByTopicUrl(String topicUrl);

    List<SubscriptionEntity> findByStatusNot(SubscriptionEntity.Status status);

    List<SubscriptionEntity> findByStatusAndExpiresAtLessThanEqual(SubscriptionEntity.Status status, LocalDateTime cutoff);
}
