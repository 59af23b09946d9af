package io.reminder4j.core;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Strongly-typed scheduler configuration.
 *
 * @param commandCapacity   bound of the command mailbox; callers block when it is full
 * @param utcOffset         fixed local offset, captured once at startup
 * @param dailyPollInterval longest single wait of a daily task before it re-reads the clock
 * @param summary           title used for every notification
 */
public record SchedulerOptions(
        int commandCapacity,
        ZoneOffset utcOffset,
        Duration dailyPollInterval,
        String summary
) {
    public static final int DEFAULT_COMMAND_CAPACITY = 8;
    public static final Duration DEFAULT_DAILY_POLL_INTERVAL = Duration.ofSeconds(60);
    public static final String DEFAULT_SUMMARY = "forget-me-not";

    public SchedulerOptions {
        if (commandCapacity <= 0) throw new IllegalArgumentException("commandCapacity must be > 0");
        if (utcOffset == null) throw new IllegalArgumentException("utcOffset must not be null");
        if (dailyPollInterval == null || dailyPollInterval.isZero() || dailyPollInterval.isNegative()) {
            throw new IllegalArgumentException("dailyPollInterval must be > 0");
        }
        if (summary == null || summary.isBlank()) throw new IllegalArgumentException("summary must not be blank");
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(
                DEFAULT_COMMAND_CAPACITY,
                OffsetDateTime.now().getOffset(),
                DEFAULT_DAILY_POLL_INTERVAL,
                DEFAULT_SUMMARY
        );
    }

    public SchedulerOptions withUtcOffset(ZoneOffset offset) {
        return new SchedulerOptions(commandCapacity, offset, dailyPollInterval, summary);
    }

    public SchedulerOptions withDailyPollInterval(Duration interval) {
        return new SchedulerOptions(commandCapacity, utcOffset, interval, summary);
    }

    public SchedulerOptions withCommandCapacity(int capacity) {
        return new SchedulerOptions(capacity, utcOffset, dailyPollInterval, summary);
    }
}
