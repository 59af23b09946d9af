package io.reminder4j.internal.mongo;

import io.reminder4j.core.ClockType;

/**
 * Discriminator of the clock rule stored in a {@link TaskDocument}.
 */
public enum ClockKind {
    ONCE,
    PERIOD,
    ONCE_PER_DAY;

    public static ClockKind of(ClockType clockType) {
        if (clockType instanceof ClockType.Once) {
            return ONCE;
        }
        if (clockType instanceof ClockType.Period) {
            return PERIOD;
        }
        return ONCE_PER_DAY;
    }
}
