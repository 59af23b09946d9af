package io.reminder4j.core;

/**
 * The scheduler's background context has terminated and no longer accepts commands.
 */
public class SchedulerUnavailableException extends IllegalStateException {

    public SchedulerUnavailableException(String message) {
        super(message);
    }

    public SchedulerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
