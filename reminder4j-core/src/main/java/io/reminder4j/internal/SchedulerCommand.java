package io.reminder4j.internal;

import io.reminder4j.core.Task;

/**
 * Messages consumed by the coordinating loop.
 *
 * <p>{@link Add} and {@link Cancel} come from callers and hold a mailbox permit; the others are
 * internal and never wait for capacity.
 */
sealed interface SchedulerCommand {

    default boolean holdsPermit() {
        return false;
    }

    record Add(Task task) implements SchedulerCommand {
        @Override
        public boolean holdsPermit() {
            return true;
        }
    }

    record Cancel(String taskId) implements SchedulerCommand {
        @Override
        public boolean holdsPermit() {
            return true;
        }
    }

    record Finished(String taskId, CancelSignal signal) implements SchedulerCommand {
    }

    record Shutdown() implements SchedulerCommand {
    }
}
