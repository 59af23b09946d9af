package io.reminder4j.utils;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.InvalidClockRuleException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ClockRuleParserTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-01-01T10:00:00Z"), ZoneOffset.UTC);

    @Test
    void parseCompactDurationShouldWork() {
        assertEquals(Duration.ofSeconds(86400 + 3600 + 60 + 1), ClockRuleParser.parseDuration("1d1h1m1s"));
        assertEquals(Duration.ofHours(2), ClockRuleParser.parseDuration("2h"));
        assertEquals(Duration.ofMinutes(55), ClockRuleParser.parseDuration("55m"));
        assertEquals(Duration.ofDays(14), ClockRuleParser.parseDuration("2w"));
    }

    @Test
    void parseHumanDurationShouldWork() {
        assertEquals(Duration.ofMinutes(5), ClockRuleParser.parseDuration("5 minutes"));
        assertEquals(Duration.ofHours(27), ClockRuleParser.parseDuration("1 day 3 hours"));
        assertEquals(Duration.ofSeconds(90), ClockRuleParser.parseDuration("90"));
    }

    @Test
    void parseDurationShouldRejectMalformedInput() {
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseDuration("1h1d"));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseDuration("3 fortnights"));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseDuration("1 hour 2 hours"));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseDuration(" "));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseDuration("99999999999999999999s"));
    }

    @Test
    void afterAndEveryShouldRejectZero() {
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.after("0s", CLOCK));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.every("0"));

        assertEquals(Instant.parse("2026-01-01T10:00:30Z"), ClockRuleParser.after("30s", CLOCK).fireAt());
        assertEquals(Duration.ofMinutes(45), ClockRuleParser.every("45m").period());
    }

    @Test
    void atShouldRescheduleAPastTimeToTomorrow() {
        ClockType.Once later = ClockRuleParser.at("18:30", ZoneOffset.ofHours(8), CLOCK);
        // 10:00Z is 18:00 at +08:00
        assertEquals(Instant.parse("2026-01-01T10:30:00Z"), later.fireAt());

        ClockType.Once passed = ClockRuleParser.at("17:59", ZoneOffset.ofHours(8), CLOCK);
        assertEquals(Instant.parse("2026-01-02T09:59:00Z"), passed.fireAt());
    }

    @Test
    void parseTimeOfDayShouldValidateRanges() {
        assertEquals(LocalTime.of(23, 1, 59), ClockRuleParser.parseTimeOfDay("23:01:59"));
        assertEquals(LocalTime.of(7, 5), ClockRuleParser.parseTimeOfDay("7:05"));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseTimeOfDay("24:00"));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseTimeOfDay("12:60"));
        assertThrows(InvalidClockRuleException.class, () -> ClockRuleParser.parseTimeOfDay("noon"));
    }

    @Test
    void dailyShouldKeepHourAndMinute() {
        assertEquals(new ClockType.OncePerDay(9, 30), ClockRuleParser.daily("09:30:45"));
    }

    @Test
    void nextDailyRunAtShouldWrapAroundMidnight() {
        Instant next = ClockRuleParser.nextDailyRunAt(0, 0, ZoneOffset.UTC, Instant.parse("2026-01-31T23:59:59Z"));
        assertEquals(Instant.parse("2026-02-01T00:00:00Z"), next);
    }

    @Test
    void nextDailyRunAtShouldApplyOffset() {
        // 23:30 at +05:30 is 18:00Z
        Instant next = ClockRuleParser.nextDailyRunAt(23, 30, ZoneOffset.ofHoursMinutes(5, 30), Instant.parse("2026-01-01T17:00:00Z"));
        assertEquals(Instant.parse("2026-01-01T18:00:00Z"), next);

        // 01:15 at -03:00 is 04:15Z
        Instant wrapped = ClockRuleParser.nextDailyRunAt(1, 15, ZoneOffset.ofHours(-3), Instant.parse("2026-01-01T05:00:00Z"));
        assertEquals(Instant.parse("2026-01-02T04:15:00Z"), wrapped);
    }

    @Test
    void nextDailyRunAtShouldBeStrictlyAfterTheGivenInstant() {
        Instant target = Instant.parse("2026-01-01T10:00:00Z");
        assertEquals(Instant.parse("2026-01-02T10:00:00Z"), ClockRuleParser.nextDailyRunAt(10, 0, ZoneOffset.UTC, target));
    }

    @Test
    void clockTypesShouldRejectInvalidValues() {
        assertThrows(InvalidClockRuleException.class, () -> new ClockType.Period(Duration.ZERO));
        assertThrows(InvalidClockRuleException.class, () -> new ClockType.OncePerDay(24, 0));
        assertThrows(InvalidClockRuleException.class, () -> new ClockType.OncePerDay(0, -1));
    }
}
