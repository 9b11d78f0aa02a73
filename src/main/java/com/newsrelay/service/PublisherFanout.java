package com.newsrelay.service;

import com.newsrelay.client.SocialPublisher;
import com.newsrelay.exception.PublishException;
import com.newsrelay.model.Destination;
import com.newsrelay.model.Item;
import com.newsrelay.model.PublishResult;
import com.newsrelay.model.RephrasedContent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Posts one rewritten item to every enabled destination in parallel.
 * Per-destination failures end up in the returned results, never as exceptions.
 */
@Service
@Slf4j
public class PublisherFanout {

    private final Map<Destination.Platform, SocialPublisher> publishers = new EnumMap<>(Destination.Platform.class);
    private final ThreadPoolTaskExecutor publishExecutor;
    private final int maxRetries;
    private final Duration timeout;

    public PublisherFanout(List<SocialPublisher> publishers,
                           @Qualifier("publishExecutor") ThreadPoolTaskExecutor publishExecutor,
                           @Value("${relay.publish.max-retries:2}") int maxRetries,
                           @Value("${relay.publish.timeout:60s}") Duration timeout) {
        for (SocialPublisher publisher : publishers) {
            this.publishers.put(publisher.platform(), publisher);
        }
        this.publishExecutor = publishExecutor;
        this.maxRetries = Math.max(0, maxRetries);
        this.timeout = timeout;
    }

    public List<PublishResult> publish(RephrasedContent content, Item item, List<Destination> destinations) {
        List<Map.Entry<Destination, CompletableFuture<PublishResult>>> tasks = new ArrayList<>();
        List<PublishResult> results = new ArrayList<>();

        for (Destination destination : destinations) {
            if (!destination.enabled()) {
                log.debug("Skipping disabled destination {}", destination.label());
                continue;
            }
            try {
                tasks.add(Map.entry(destination, CompletableFuture.supplyAsync(
                        () -> publishWithRetries(destination, content, item), publishExecutor)));
            } catch (TaskRejectedException e) {
                log.error("Publish queue full, dropping {} for item {}", destination.label(), item.id());
                tasks.add(Map.entry(destination, CompletableFuture.completedFuture(
                        PublishResult.failed(destination, "rejected: publish queue full", 0))));
            }
        }
        if (tasks.isEmpty()) {
            log.warn("No enabled destinations for item {}", item.id());
            return results;
        }

        long deadline = System.nanoTime() + timeout.toNanos();
        for (Map.Entry<Destination, CompletableFuture<PublishResult>> task : tasks) {
            Destination destination = task.getKey();
            long remaining = Math.max(0, deadline - System.nanoTime());
            try {
                results.add(task.getValue().get(remaining, TimeUnit.NANOSECONDS));
            } catch (TimeoutException e) {
                log.warn("Publishing item {} to {} timed out after {}s", item.id(), destination.label(), timeout.toSeconds());
                results.add(PublishResult.failed(destination, "timed out", 0));
            } catch (ExecutionException e) {
                log.error("Publish task for {} crashed: {}", destination.label(), e.getCause().getMessage(), e.getCause());
                results.add(PublishResult.failed(destination, String.valueOf(e.getCause().getMessage()), 0));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                results.add(PublishResult.failed(destination, "interrupted", 0));
            }
        }

        long succeeded = results.stream().filter(PublishResult::success).count();
        log.info("Item {} published to {}/{} destination(s)", item.id(), succeeded, results.size());
        return results;
    }

    private PublishResult publishWithRetries(Destination destination, RephrasedContent content, Item item) {
        SocialPublisher publisher = publishers.get(destination.platform());
        if (publisher == null) {
            return PublishResult.failed(destination, "no publisher for platform " + destination.platform(), 0);
        }

        int attempts = 0;
        while (true) {
            attempts++;
            try {
                String postId = publisher.publish(destination, content, item);
                return PublishResult.ok(destination, postId, attempts);
            } catch (PublishException e) {
                if (!e.isTransientFailure() || attempts > maxRetries) {
                    log.error("Publishing item {} to {} failed after {} attempt(s): {}",
                            item.id(), destination.label(), attempts, e.getMessage());
                    return PublishResult.failed(destination, e.getMessage(), attempts);
                }
                log.warn("Transient failure publishing item {} to {} (attempt {}): {}",
                        item.id(), destination.label(), attempts, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Unexpected error publishing item {} to {}", item.id(), destination.label(), e);
                return PublishResult.failed(destination, e.getMessage(), attempts);
            }
        }
    }
}
