package com.newsrelay.repository;

import com.newsrelay.model.ProcessedItemEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

@Repository
public interface ProcessedItemRepository extends JpaRepository<ProcessedItemEntity, Long> {

    Optional<ProcessedItemEntity> findByItemKey(String itemKey);

    default Optional<ProcessedItemEntity> findByItemId(String itemId) {
        return findByItemKey(ProcessedItemEntity.keyOf(itemId));
    }

    @Query("SELECT p FROM ProcessedItemEntity p WHERE p.itemKey = :itemKey AND p.expiresAt > :now")
    Optional<ProcessedItemEntity> findLiveByItemKey(
            @Param("itemKey") String itemKey,
            @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM ProcessedItemEntity p WHERE p.expiresAt <= :now")
    int deleteExpired(@Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM ProcessedItemEntity p WHERE p.itemKey = :itemKey AND p.expiresAt <= :now")
    int deleteExpiredByItemKey(@Param("itemKey") String itemKey, @Param("now") LocalDateTime now);

    @Modifying
    @Query("DELETE FROM ProcessedItemEntity p WHERE p.itemKey = :itemKey AND p.status = :status")
    int deleteByItemKeyAndStatus(
            @Param("itemKey") String itemKey,
            @Param("status") ProcessedItemEntity.Status status);

    @Modifying
    @Query("UPDATE ProcessedItemEntity p SET p.expiresAt = :expiresAt WHERE p.itemKey IN :itemKeys AND p.status = :status")
    int extendExpiry(
            @Param("itemKeys") Collection<String> itemKeys,
            @Param("status") ProcessedItemEntity.Status status,
            @Param("expiresAt") LocalDateTime expiresAt);
}
