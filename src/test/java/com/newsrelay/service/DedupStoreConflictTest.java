package com.newsrelay.service;

import com.newsrelay.model.Item;
import com.newsrelay.model.ProcessedItemEntity;
import com.newsrelay.repository.ProcessedItemRepository;
import com.newsrelay.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DedupStore claim conflicts")
class DedupStoreConflictTest {

    @Mock
    private ProcessedItemRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private DedupStore store;

    private final Item item = new Item("guid-1", "Title", "https://example.com/a", "", null, null, null);
    private final String key = ProcessedItemEntity.keyOf("guid-1");

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        store = new DedupStore(repository, transactionManager, clock, Duration.ofHours(24), Duration.ofMinutes(10));
    }

    @Test
    @DisplayName("should report a lost race when the competing claim is visible")
    void shouldTreatDuplicateAsLostRace() {
        ProcessedItemEntity winner = new ProcessedItemEntity("guid-1", ProcessedItemEntity.Status.CLAIMED, "Title", null,
                LocalDateTime.of(2025, 1, 1, 0, 0), LocalDateTime.of(2025, 1, 1, 0, 10));
        when(repository.findLiveByItemKey(eq(key), any(LocalDateTime.class)))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(winner));
        when(repository.saveAndFlush(any(ProcessedItemEntity.class)))
                .thenThrow(new DuplicateKeyException("duplicate key idx_processed_item_id"));

        assertThat(store.claim(item)).isFalse();
    }

    @Test
    @DisplayName("should propagate integrity errors that are not a competing claim")
    void shouldPropagateOtherIntegrityErrors() {
        when(repository.findLiveByItemKey(eq(key), any(LocalDateTime.class))).thenReturn(Optional.empty());
        when(repository.saveAndFlush(any(ProcessedItemEntity.class)))
                .thenThrow(new DataIntegrityViolationException("value too long for column"));

        assertThatThrownBy(() -> store.claim(item))
                .isInstanceOf(DataIntegrityViolationException.class)
                .hasMessageContaining("value too long");
    }
}
