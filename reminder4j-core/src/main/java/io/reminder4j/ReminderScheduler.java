package io.reminder4j;

import io.reminder4j.core.SchedulerUnavailableException;
import io.reminder4j.core.Task;

/**
 * Main scheduler API.
 *
 * <p>Calls are accepted from any thread and handed to a single background coordinator over a
 * bounded mailbox. A call returns once its command is queued, not once it has been processed;
 * when the mailbox is full the caller blocks until there is room.
 *
 * <p>Typical usage:
 * <pre>{@code
 * ReminderScheduler scheduler = new DefaultReminderScheduler(SchedulerOptions.defaults(), notifier);
 *
 * Task task = Task.create("stretch", new ClockType.Period(Duration.ofMinutes(45)));
 * scheduler.addTask(task);
 * ...
 * scheduler.cancelTask(task);
 * scheduler.close();
 * }</pre>
 */
public interface ReminderScheduler extends AutoCloseable {

    /**
     * Schedule a task. Its clock rule must already be valid; it is not checked again here.
     *
     * @throws SchedulerUnavailableException if the background context has terminated, or if the
     *         calling thread is interrupted while waiting for room in the mailbox; in the latter
     *         case the interrupt flag is restored and {@link #isAvailable()} stays true
     */
    void addTask(Task task);

    /**
     * Request cancellation of a task by its id. Cancelling an unknown or already finished task
     * is a no-op, not an error.
     *
     * @throws SchedulerUnavailableException if the background context has terminated, or if the
     *         calling thread is interrupted while waiting for room in the mailbox
     */
    void cancelTask(Task task);

    /**
     * Whether the background context is still accepting commands.
     */
    boolean isAvailable();

    /**
     * Stop every live task and terminate the background context. Idempotent.
     */
    @Override
    void close();
}
