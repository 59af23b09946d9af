package io.reminder4j.core;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Firing rule of a {@link Task}.
 *
 * <p>Values are validated on construction, so a rule that reaches the scheduler is always
 * well-formed:
 * <ul>
 *   <li>{@link Once}: a single fire at an absolute instant</li>
 *   <li>{@link Period}: a fire every {@code period}, forever until cancelled</li>
 *   <li>{@link OncePerDay}: a fire once per day at {@code hour:minute} local time</li>
 * </ul>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ClockType.Once.class, name = "once"),
        @JsonSubTypes.Type(value = ClockType.Period.class, name = "period"),
        @JsonSubTypes.Type(value = ClockType.OncePerDay.class, name = "oncePerDay")
})
public sealed interface ClockType permits ClockType.Once, ClockType.Period, ClockType.OncePerDay {

    DateTimeFormatter DISPLAY_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /**
     * Short human-readable form, e.g. {@code at 2026-01-01 09:30}, {@code every 60 secs}.
     */
    String describe(ZoneOffset offset);

    record Once(Instant fireAt) implements ClockType {
        public Once {
            Objects.requireNonNull(fireAt, "fireAt must not be null");
        }

        @Override
        public String describe(ZoneOffset offset) {
            return "at " + DISPLAY_FORMAT.format(fireAt.atOffset(offset));
        }
    }

    record Period(Duration period) implements ClockType {
        public Period {
            Objects.requireNonNull(period, "period must not be null");
            if (period.isZero() || period.isNegative()) {
                throw new InvalidClockRuleException("period must be a positive duration: " + period);
            }
        }

        @Override
        public String describe(ZoneOffset offset) {
            long seconds = period.toSeconds();
            return seconds == 0 ? "every " + period : "every " + seconds + " secs";
        }
    }

    record OncePerDay(int hour, int minute) implements ClockType {
        public OncePerDay {
            if (hour < 0 || hour > 23) {
                throw new InvalidClockRuleException("hour must be within 0..23: " + hour);
            }
            if (minute < 0 || minute > 59) {
                throw new InvalidClockRuleException("minute must be within 0..59: " + minute);
            }
        }

        @Override
        public String describe(ZoneOffset offset) {
            return String.format("daily at %02d:%02d", hour, minute);
        }
    }
}
