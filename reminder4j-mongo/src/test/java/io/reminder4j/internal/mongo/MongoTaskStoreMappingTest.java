package io.reminder4j.internal.mongo;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.Task;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class MongoTaskStoreMappingTest {

    @Test
    void dailyRuleIsFlattenedIntoHourAndMinute() {
        Task task = Task.create("standup", new ClockType.OncePerDay(9, 15), null, null, Instant.parse("2026-01-01T00:00:00Z"));

        TaskDocument doc = MongoTaskStore.toDocument(task);

        assertEquals(ClockKind.ONCE_PER_DAY, doc.getClockKind());
        assertEquals(9, doc.getHour());
        assertEquals(15, doc.getMinute());
        assertNull(doc.getFireAt());
        assertNull(doc.getPeriod());
        assertEquals(task, MongoTaskStore.toTask(doc));
    }

    @Test
    void subMillisecondPeriodKeepsItsPrecision() {
        Duration halfMilli = Duration.ofNanos(500_000);
        Task task = Task.create("tight loop", new ClockType.Period(halfMilli), null, null, Instant.parse("2026-01-01T00:00:00Z"));

        TaskDocument doc = MongoTaskStore.toDocument(task);

        assertEquals(ClockKind.PERIOD, doc.getClockKind());
        assertEquals("PT0.0005S", doc.getPeriod());
        assertEquals(new ClockType.Period(halfMilli), MongoTaskStore.toTask(doc).clockType());
    }

    @Test
    void incompleteDocumentIsRejected() {
        TaskDocument doc = new TaskDocument();
        doc.setId("abc");
        doc.setDescription("broken");
        doc.setClockKind(ClockKind.ONCE);
        doc.setCreatedAt(Instant.parse("2026-01-01T00:00:00Z"));

        assertThrows(IllegalStateException.class, () -> MongoTaskStore.toTask(doc));
    }
}
