package io.reminder4j;

import io.reminder4j.core.Notification;
import io.reminder4j.core.NotifyException;

/**
 * Renders a notification when a task fires.
 *
 * <p>Called on the scheduler's timer thread, so implementations should return promptly.
 * A failure reported here permanently stops a recurring task.
 */
@FunctionalInterface
public interface Notifier {

    void send(Notification notification) throws NotifyException;
}
