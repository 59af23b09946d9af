package io.reminder4j.internal;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.Task;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryTaskStoreTest {

    @Test
    void listIsOrderedByCreationTimeAndClearEmptiesTheStore() {
        InMemoryTaskStore store = new InMemoryTaskStore();
        ClockType clock = new ClockType.Period(Duration.ofMinutes(1));
        Task newer = Task.create("newer", clock, null, null, Instant.parse("2026-01-02T00:00:00Z"));
        Task older = Task.create("older", clock, null, null, Instant.parse("2026-01-01T00:00:00Z"));

        store.save(newer);
        store.save(older);

        assertEquals(List.of(older, newer), store.list());
        assertEquals(newer, store.remove(newer.taskId()).orElseThrow());
        assertTrue(store.remove(newer.taskId()).isEmpty());
        assertEquals(1, store.clear());
        assertTrue(store.list().isEmpty());
    }
}
