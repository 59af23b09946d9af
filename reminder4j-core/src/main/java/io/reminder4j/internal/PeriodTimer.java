package io.reminder4j.internal;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Fires every {@code period} until cancelled. The first failed delivery ends the schedule.
 */
final class PeriodTimer extends TimerBehavior {
    private static final Logger log = LoggerFactory.getLogger(PeriodTimer.class);

    private final Duration period;

    PeriodTimer(Task task, ClockType.Period period, Context context) {
        super(task, context);
        this.period = period.period();
    }

    @Override
    protected void run() {
        race(period, this::wake);
    }

    private void wake() {
        log.info("a clock with period {} secs and description {} fired id={}",
                period.toSeconds(), task.description(), task.taskId());
        if (!deliver()) {
            escalate();
            return;
        }
        race(period, this::wake);
    }

    @Override
    protected void onCancelled() {
        log.info("periodic task with period {} is cancelled id={}", period, task.taskId());
    }
}
