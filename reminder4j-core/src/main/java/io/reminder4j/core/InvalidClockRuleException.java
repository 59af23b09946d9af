package io.reminder4j.core;

/**
 * A duration, time of day or clock rule that cannot be scheduled.
 * Raised before a {@link Task} is built; the scheduler never sees these.
 */
public class InvalidClockRuleException extends IllegalArgumentException {

    public InvalidClockRuleException(String message) {
        super(message);
    }

    public InvalidClockRuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
