package io.reminder4j.utils;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.InvalidClockRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns user input into validated {@link ClockType} values.
 * <p>
 * Supported duration formats:
 * <ul>
 *   <li>Compact: "1d2h3m4s", "2h", "30s", "55m", "2w" (units in that order, each optional)</li>
 *   <li>Plain seconds: "90"</li>
 *   <li>Human-readable pairs: "5 minutes", "1 day 3 hours"</li>
 * </ul>
 * Times of day are "HH:mm" or "HH:mm:ss" and are read in a fixed UTC offset.
 */
public final class ClockRuleParser {
    private static final Logger log = LoggerFactory.getLogger(ClockRuleParser.class);

    private static final Pattern COMPACT = Pattern.compile(
            "^(?:(?<week>\\d+)w)?(?:(?<day>\\d+)d)?(?:(?<hour>\\d+)h)?(?:(?<minute>\\d+)m)?(?:(?<second>\\d+)s)?$"
    );
    private static final Pattern TIME_OF_DAY = Pattern.compile(
            "^(?<hour>\\d{1,2}):(?<minute>\\d{1,2})(?::(?<second>\\d{1,2}))?$"
    );

    private ClockRuleParser() {
    }

    /**
     * One-shot rule firing {@code spec} from now.
     */
    public static ClockType.Once after(String spec, Clock clock) {
        Duration d = parseDuration(spec);
        if (d.isZero()) {
            throw new InvalidClockRuleException("after <duration> must not be 0");
        }
        return new ClockType.Once(clock.instant().plus(d));
    }

    /**
     * Recurring rule firing every {@code spec}.
     */
    public static ClockType.Period every(String spec) {
        Duration d = parseDuration(spec);
        if (d.isZero()) {
            throw new InvalidClockRuleException("every <duration> must not be 0");
        }
        return new ClockType.Period(d);
    }

    /**
     * One-shot rule firing at the next occurrence of a time of day. A time that has already
     * passed today is moved to tomorrow.
     */
    public static ClockType.Once at(String spec, ZoneOffset offset, Clock clock) {
        LocalTime time = parseTimeOfDay(spec);
        OffsetDateTime now = clock.instant().atOffset(offset);
        OffsetDateTime candidate = now.with(time);
        if (!candidate.isAfter(now)) {
            log.warn("clock time {} is already in the past, rescheduling it tomorrow", candidate);
            candidate = candidate.plusDays(1);
        }
        return new ClockType.Once(candidate.toInstant());
    }

    /**
     * Daily rule at the hour and minute of {@code spec}; seconds are ignored.
     */
    public static ClockType.OncePerDay daily(String spec) {
        LocalTime time = parseTimeOfDay(spec);
        return new ClockType.OncePerDay(time.getHour(), time.getMinute());
    }

    /**
     * First instant strictly after {@code after} whose local time in {@code offset} is
     * {@code hour:minute}.
     */
    public static Instant nextDailyRunAt(int hour, int minute, ZoneOffset offset, Instant after) {
        OffsetDateTime base = after.atOffset(offset);
        OffsetDateTime candidate = base.with(LocalTime.of(hour, minute));
        if (!candidate.isAfter(base)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }

    /**
     * Offset of the clock's zone at the clock's current instant.
     */
    public static ZoneOffset systemOffset(Clock clock) {
        return clock.getZone().getRules().getOffset(clock.instant());
    }

    public static LocalTime parseTimeOfDay(String spec) {
        if (spec == null) {
            throw new InvalidClockRuleException("time must not be null");
        }
        Matcher m = TIME_OF_DAY.matcher(spec.trim());
        if (!m.matches()) {
            throw new InvalidClockRuleException("invalid time! correct examples: 13:11, 23:01:59, got: " + spec);
        }
        int hour = Integer.parseInt(m.group("hour"));
        int minute = Integer.parseInt(m.group("minute"));
        int second = m.group("second") == null ? 0 : Integer.parseInt(m.group("second"));
        if (hour > 23 || minute > 59 || second > 59) {
            throw new InvalidClockRuleException("time out of range: " + spec);
        }
        return LocalTime.of(hour, minute, second);
    }

    /**
     * Parse a duration spec. Zero is a valid result here; callers that need a positive
     * duration check it themselves.
     */
    public static Duration parseDuration(String spec) {
        if (spec == null) {
            throw new InvalidClockRuleException("duration must not be null");
        }
        String s = spec.trim().toLowerCase();
        if (s.isEmpty()) {
            throw new InvalidClockRuleException("duration must not be empty");
        }

        try {
            if (s.matches("^\\d+$")) {
                return Duration.ofSeconds(Long.parseLong(s));
            }

            Matcher m = COMPACT.matcher(s);
            if (m.matches()) {
                return Duration.ofDays(7L * number(m, "week"))
                        .plusDays(number(m, "day"))
                        .plusHours(number(m, "hour"))
                        .plusMinutes(number(m, "minute"))
                        .plusSeconds(number(m, "second"));
            }

            return parseHumanDuration(s, spec);
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new InvalidClockRuleException("duration out of range: " + spec, ex);
        }
    }

    private static long number(Matcher m, String group) {
        String value = m.group(group);
        return value == null ? 0L : Long.parseLong(value);
    }

    private static Duration parseHumanDuration(String s, String input) {
        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new InvalidClockRuleException(
                    "invalid duration format; valid examples: 1d1h1m1s, 2h, 30s, 55m, '3 minutes': " + input);
        }

        boolean seenWeek = false, seenDay = false, seenHour = false, seenMinute = false, seenSecond = false;
        long totalSeconds = 0;

        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new InvalidClockRuleException("invalid number in duration: " + parts[i]);
            }
            if (n < 0) {
                throw new InvalidClockRuleException("duration values must be non-negative");
            }

            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "week" -> {
                    if (seenWeek) throw new InvalidClockRuleException("duplicate unit: week");
                    seenWeek = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.WEEKS.getDuration().toSeconds(), n));
                }
                case "day" -> {
                    if (seenDay) throw new InvalidClockRuleException("duplicate unit: day");
                    seenDay = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.DAYS.getDuration().toSeconds(), n));
                }
                case "hour" -> {
                    if (seenHour) throw new InvalidClockRuleException("duplicate unit: hour");
                    seenHour = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.HOURS.getDuration().toSeconds(), n));
                }
                case "minute" -> {
                    if (seenMinute) throw new InvalidClockRuleException("duplicate unit: minute");
                    seenMinute = true;
                    totalSeconds = Math.addExact(totalSeconds, Math.multiplyExact(ChronoUnit.MINUTES.getDuration().toSeconds(), n));
                }
                case "second" -> {
                    if (seenSecond) throw new InvalidClockRuleException("duplicate unit: second");
                    seenSecond = true;
                    totalSeconds = Math.addExact(totalSeconds, n);
                }
                default -> throw new InvalidClockRuleException("unsupported duration unit: " + parts[i + 1]);
            }
        }

        return Duration.ofSeconds(totalSeconds);
    }
}
