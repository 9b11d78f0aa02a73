package com.newsrelay.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rotating set of API keys for the rephrase backend.
 * <p>
 * Each key lives in a slot that is either available, cooling down until some
 * instant after a rate limit or server error, or exhausted for good after the
 * provider rejected it. All transitions happen under the pool's monitor.
 */
@Slf4j
public class ApiKeyPool {

    public enum SlotState { AVAILABLE, COOLING_DOWN, EXHAUSTED }

    private final List<Slot> slots = new ArrayList<>();
    private final Clock clock;
    private final Duration cooldownBase;
    private final Duration cooldownMax;
    private int cursor;

    public ApiKeyPool(List<String> keys, Clock clock, Duration cooldownBase, Duration cooldownMax) {
        for (String key : keys) {
            if (key != null && !key.isBlank()) {
                slots.add(new Slot(slots.size(), key.trim()));
            }
        }
        this.clock = clock;
        this.cooldownBase = cooldownBase;
        this.cooldownMax = cooldownMax;
    }

    public int size() {
        return slots.size();
    }

    /**
     * Next usable key in round-robin order, or empty when every slot is cooling down or exhausted.
     */
    public synchronized Optional<Lease> acquire() {
        Instant now = clock.instant();
        for (int i = 0; i < slots.size(); i++) {
            Slot slot = slots.get((cursor + i) % slots.size());
            if (slot.state == SlotState.COOLING_DOWN && !now.isBefore(slot.cooldownUntil)) {
                slot.state = SlotState.AVAILABLE;
                slot.cooldownUntil = null;
                log.info("API key slot {} is available again", slot.index);
            }
            if (slot.state == SlotState.AVAILABLE) {
                cursor = (slot.index + 1) % slots.size();
                return Optional.of(new Lease(slot.index, slot.key));
            }
        }
        return Optional.empty();
    }

    public synchronized void markSuccess(Lease lease) {
        Slot slot = slots.get(lease.index());
        slot.consecutiveFailures = 0;
    }

    /**
     * Rate limit, 5xx or I/O failure: the slot sits out {@code base * 2^(failures-1)}, capped.
     */
    public synchronized Instant markTransientFailure(Lease lease) {
        Slot slot = slots.get(lease.index());
        if (slot.state == SlotState.EXHAUSTED) {
            return null;
        }
        slot.consecutiveFailures++;
        Duration cooldown = backoff(slot.consecutiveFailures);
        slot.state = SlotState.COOLING_DOWN;
        slot.cooldownUntil = clock.instant().plus(cooldown);
        log.warn("API key slot {} ({}) cooling down for {}s after {} consecutive failure(s)",
                slot.index, lease.maskedKey(), cooldown.toSeconds(), slot.consecutiveFailures);
        return slot.cooldownUntil;
    }

    public synchronized void markExhausted(Lease lease) {
        Slot slot = slots.get(lease.index());
        slot.state = SlotState.EXHAUSTED;
        slot.cooldownUntil = null;
        log.error("API key slot {} ({}) rejected by provider, removed from rotation", slot.index, lease.maskedKey());
    }

    public synchronized SlotState stateOf(int index) {
        Slot slot = slots.get(index);
        if (slot.state == SlotState.COOLING_DOWN && !clock.instant().isBefore(slot.cooldownUntil)) {
            return SlotState.AVAILABLE;
        }
        return slot.state;
    }

    public synchronized Instant cooldownUntil(int index) {
        return slots.get(index).cooldownUntil;
    }

    public synchronized int consecutiveFailures(int index) {
        return slots.get(index).consecutiveFailures;
    }

    private Duration backoff(int failures) {
        int shift = Math.min(failures - 1, 20);
        Duration candidate = cooldownBase.multipliedBy(1L << shift);
        return candidate.compareTo(cooldownMax) > 0 ? cooldownMax : candidate;
    }

    /** A key handed out for one call. */
    public record Lease(int index, String key) {
        public String maskedKey() {
            return key.length() < 4 ? "****" : "****" + key.substring(key.length() - 4);
        }

        @Override
        public String toString() {
            return "Lease[" + index + ", " + maskedKey() + "]";
        }
    }

    private static final class Slot {
        private final int index;
        private final String key;
        private SlotState state = SlotState.AVAILABLE;
        private Instant cooldownUntil;
        private int consecutiveFailures;

        private Slot(int index, String key) {
            this.index = index;
            this.key = key;
        }
    }
}
