package com.newsrelay.service;

import com.newsrelay.model.Item;
import com.newsrelay.model.ProcessedItemEntity;
import com.newsrelay.model.ProcessedItemEntity.Status;
import com.newsrelay.repository.ProcessedItemRepository;
import com.newsrelay.util.FeedText;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers which items were already relayed so a hub redelivery (or two hubs
 * pushing the same entry) never produces a second post.
 * <p>
 * The webhook path uses {@link #claim(Item)} / {@link #commit(String)} /
 * {@link #release(String)}; the unique index on the id hash is what makes a
 * claim win exactly once across concurrent requests. Claims held by this process
 * are renewed until they are committed or released.
 */
@Service
@Slf4j
public class DedupStore {

    private final ProcessedItemRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration ttl;
    private final Duration claimTtl;
    private final Set<String> heldClaims = ConcurrentHashMap.newKeySet();

    public DedupStore(ProcessedItemRepository repository,
                      PlatformTransactionManager transactionManager,
                      Clock clock,
                      @Value("${relay.dedup.ttl:24h}") Duration ttl,
                      @Value("${relay.dedup.claim-ttl:10m}") Duration claimTtl) {
        this.repository = repository;
        this.ttl = ttl;
        this.claimTtl = claimTtl;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    public boolean hasSeen(String itemId) {
        return repository.findLiveByItemKey(ProcessedItemEntity.keyOf(itemId), now()).isPresent();
    }

    public void markSeen(String itemId, Duration recordTtl) {
        LocalDateTime now = now();
        transactionTemplate.executeWithoutResult(status -> publish(itemId, now, now.plus(recordTtl)));
    }

    /**
     * Atomically records that this process is about to relay {@code item}.
     *
     * @return true when the caller owns the item, false when it is already published or in flight
     */
    public boolean claim(Item item) {
        String key = ProcessedItemEntity.keyOf(item.id());
        LocalDateTime now = now();
        try {
            Boolean claimed = transactionTemplate.execute(status -> {
                repository.deleteExpiredByItemKey(key, now);
                if (repository.findLiveByItemKey(key, now).isPresent()) {
                    return false;
                }
                repository.saveAndFlush(new ProcessedItemEntity(item.id(), Status.CLAIMED,
                        FeedText.truncate(item.title(), 1000), item.link(), now, now.plus(claimTtl)));
                return true;
            });
            if (Boolean.TRUE.equals(claimed)) {
                heldClaims.add(key);
                return true;
            }
            return false;
        } catch (DataIntegrityViolationException | ConcurrencyFailureException e) {
            // Only a live row written by the competing request counts as a lost race.
            if (repository.findLiveByItemKey(key, now()).isPresent()) {
                log.debug("Lost claim race for item {}: {}", item.id(), e.getMessage());
                return false;
            }
            throw e;
        }
    }

    /**
     * Pushes the lease of a claim this process holds out by another claim ttl.
     * A claim that vanished in the meantime is taken again if nobody else owns the item.
     *
     * @return false when the item is now published or claimed elsewhere
     */
    public boolean renewClaim(Item item) {
        String key = ProcessedItemEntity.keyOf(item.id());
        if (heldClaims.contains(key)) {
            LocalDateTime expiresAt = now().plus(claimTtl);
            Integer updated = transactionTemplate.execute(status ->
                    repository.extendExpiry(List.of(key), Status.CLAIMED, expiresAt));
            if (updated != null && updated > 0) {
                return true;
            }
            heldClaims.remove(key);
        }
        log.warn("Claim on item {} was lost, trying to take it again", item.id());
        return claim(item);
    }

    /**
     * Keeps every claim held by this process alive while its item waits or runs.
     * Claims of a crashed process stop being renewed and lapse after the claim ttl.
     */
    @Scheduled(fixedDelayString = "${relay.dedup.claim-renew-interval-ms:60000}",
               initialDelayString = "${relay.dedup.claim-renew-interval-ms:60000}")
    public void renewHeldClaims() {
        if (heldClaims.isEmpty()) {
            return;
        }
        Set<String> keys = Set.copyOf(heldClaims);
        LocalDateTime expiresAt = now().plus(claimTtl);
        Integer renewed = transactionTemplate.execute(status -> repository.extendExpiry(keys, Status.CLAIMED, expiresAt));
        log.debug("Renewed {}/{} held claim(s) until {}", renewed, keys.size(), expiresAt);
    }

    public void commit(String itemId) {
        LocalDateTime now = now();
        transactionTemplate.executeWithoutResult(status -> publish(itemId, now, now.plus(ttl)));
        heldClaims.remove(ProcessedItemEntity.keyOf(itemId));
        log.debug("Committed item {} until {}", itemId, now.plus(ttl));
    }

    public void release(String itemId) {
        String key = ProcessedItemEntity.keyOf(itemId);
        heldClaims.remove(key);
        Integer removed = transactionTemplate.execute(status ->
                repository.deleteByItemKeyAndStatus(key, Status.CLAIMED));
        if (removed != null && removed > 0) {
            log.info("Released claim on item {}", itemId);
        }
    }

    private void publish(String itemId, LocalDateTime now, LocalDateTime expiresAt) {
        ProcessedItemEntity entity = repository.findByItemKey(ProcessedItemEntity.keyOf(itemId))
                .orElseGet(() -> new ProcessedItemEntity(itemId, Status.PUBLISHED, null, null, now, now));
        if (!entity.isLive(now)) {
            entity.setFirstSeenAt(now);
        }
        entity.setStatus(Status.PUBLISHED);
        entity.setExpiresAt(expiresAt);
        repository.save(entity);
    }

    public int purgeExpired() {
        Integer removed = transactionTemplate.execute(status -> repository.deleteExpired(now()));
        int count = removed != null ? removed : 0;
        if (count > 0) {
            log.info("Purged {} expired dedup records", count);
        }
        return count;
    }

    @Scheduled(fixedDelayString = "${relay.dedup.cleanup-interval-ms:3600000}",
               initialDelayString = "${relay.dedup.cleanup-interval-ms:3600000}")
    public void scheduledPurge() {
        purgeExpired();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void purgeOnStartup() {
        int removed = purgeExpired();
        log.info("Startup sweep removed {} expired dedup records", removed);
    }

    public Duration getTtl() {
        return ttl;
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
