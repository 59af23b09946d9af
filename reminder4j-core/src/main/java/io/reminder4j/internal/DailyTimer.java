package io.reminder4j.internal;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.Task;
import io.reminder4j.utils.ClockRuleParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

/**
 * Fires once a day at {@code hour:minute} in a fixed offset.
 *
 * <p>Each round targets the next exact occurrence strictly after the previous target, so a day
 * can never fire twice. Long waits are cut into slices of at most {@code pollInterval} and the
 * clock is re-read after each slice. An occurrence is only delivered while the clock is still
 * inside its minute; one woken up later than that (clock jump, host suspend) is skipped.
 */
final class DailyTimer extends TimerBehavior {
    private static final Logger log = LoggerFactory.getLogger(DailyTimer.class);

    static final Duration MATCH_WINDOW = Duration.ofMinutes(1);

    private final int hour;
    private final int minute;
    private final ZoneOffset offset;
    private final Duration pollInterval;

    DailyTimer(Task task, ClockType.OncePerDay daily, ZoneOffset offset, Duration pollInterval, Context context) {
        super(task, context);
        this.hour = daily.hour();
        this.minute = daily.minute();
        this.offset = offset;
        this.pollInterval = pollInterval;
    }

    @Override
    protected void run() {
        arm(clock.instant());
    }

    private void arm(Instant after) {
        Instant target = ClockRuleParser.nextDailyRunAt(hour, minute, offset, after);
        log.debug("daily task id={} armed for {}", task.taskId(), target);
        awaitTarget(target);
    }

    private void awaitTarget(Instant target) {
        Duration remaining = Duration.between(clock.instant(), target);
        if (remaining.isNegative()) {
            remaining = Duration.ZERO;
        }
        boolean lastSlice = remaining.compareTo(pollInterval) <= 0;
        Duration sleep = lastSlice ? remaining : pollInterval;

        race(sleep, () -> {
            if (!lastSlice && clock.instant().isBefore(target)) {
                awaitTarget(target);
                return;
            }
            fire(target);
        });
    }

    private void fire(Instant target) {
        Instant woke = clock.instant();
        if (!woke.isBefore(target.plus(MATCH_WINDOW))) {
            log.warn("daily task id={} missed its occurrence at {} (woke at {}), waiting for the next one",
                    task.taskId(), target, woke);
            arm(woke);
            return;
        }
        log.info("a clock at {}:{} everyday and description {} fired id={}",
                hour, minute, task.description(), task.taskId());
        if (!deliver()) {
            escalate();
            return;
        }
        Instant now = clock.instant();
        arm(now.isAfter(target) ? now : target);
    }

    @Override
    protected void onCancelled() {
        log.info("everyday task at {}:{} is cancelled id={}", hour, minute, task.taskId());
    }
}
