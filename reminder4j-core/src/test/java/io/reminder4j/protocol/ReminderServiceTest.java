package io.reminder4j.protocol;

import io.reminder4j.ReminderScheduler;
import io.reminder4j.core.ClockType;
import io.reminder4j.core.SchedulerUnavailableException;
import io.reminder4j.core.Task;
import io.reminder4j.internal.InMemoryTaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class ReminderServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);

    private ReminderScheduler scheduler;
    private InMemoryTaskStore store;
    private ReminderService service;

    @BeforeEach
    void setUp() {
        scheduler = mock(ReminderScheduler.class);
        store = new InMemoryTaskStore();
        service = new ReminderService(scheduler, store, CLOCK, "/icons/default.png", null);
    }

    @Test
    void addSchedulesAndRegistersTheTask() {
        Response response = service.handle(new Request.Add("stretch", new ClockType.Period(Duration.ofMinutes(45)), null, "/sounds/bell.ogg"));

        Response.AddSuccess success = assertInstanceOf(Response.AddSuccess.class, response);
        ArgumentCaptor<Task> captor = ArgumentCaptor.forClass(Task.class);
        verify(scheduler).addTask(captor.capture());

        Task task = captor.getValue();
        assertEquals(success.taskId(), task.taskId());
        assertEquals("stretch", task.description());
        assertEquals("/icons/default.png", task.imagePath());
        assertEquals("/sounds/bell.ogg", task.soundPath());
        assertEquals(CLOCK.instant(), task.createdAt());
        assertTrue(store.find(task.taskId()).isPresent());
    }

    @Test
    void cancelUnknownTaskFailsWithoutTouchingTheScheduler() {
        Response response = service.handle(new Request.Cancel("nope"));

        assertInstanceOf(Response.Fail.class, response);
        verify(scheduler, never()).cancelTask(any());
    }

    @Test
    void cancelKnownTaskRemovesIt() {
        Response.AddSuccess added = (Response.AddSuccess) service.handle(
                new Request.Add("tea", new ClockType.Once(CLOCK.instant().plusSeconds(60)), null, null));

        Response response = service.handle(new Request.Cancel(added.taskId()));

        assertEquals(new Response.RemoveSuccess(added.taskId()), response);
        verify(scheduler).cancelTask(any(Task.class));
        assertTrue(store.find(added.taskId()).isEmpty());
    }

    @Test
    void showListsTasksInCreationOrder() {
        service.handle(new Request.Add("first", new ClockType.OncePerDay(9, 0), null, null));
        service.handle(new Request.Add("second", new ClockType.OncePerDay(10, 0), null, null));

        Response.GetTasks tasks = assertInstanceOf(Response.GetTasks.class, service.handle(new Request.Show()));

        assertEquals(2, tasks.tasks().size());
    }

    @Test
    void unavailableSchedulerIsReportedAsFail() {
        doThrow(new SchedulerUnavailableException("the reminder scheduler has terminated"))
                .when(scheduler).addTask(any());

        Response response = service.handle(new Request.Add("x", new ClockType.Period(Duration.ofSeconds(5)), null, null));

        Response.Fail fail = assertInstanceOf(Response.Fail.class, response);
        assertEquals("the reminder scheduler has terminated", fail.message());
        assertTrue(store.list().isEmpty());
    }

    @Test
    void removalListenerPrunesFinishedTasks() {
        Response.AddSuccess added = (Response.AddSuccess) service.handle(
                new Request.Add("tea", new ClockType.Once(CLOCK.instant().plusSeconds(60)), null, null));
        Task task = store.find(added.taskId()).orElseThrow();

        store.removalListener().onFinished(task);

        assertNull(store.find(added.taskId()).orElse(null));
    }
}
