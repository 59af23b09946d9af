package io.reminder4j.internal;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Fires once at an absolute instant. A fire time that is not in the future is dropped.
 */
final class OnceTimer extends TimerBehavior {
    private static final Logger log = LoggerFactory.getLogger(OnceTimer.class);

    private final Instant fireAt;

    OnceTimer(Task task, ClockType.Once once, Context context) {
        super(task, context);
        this.fireAt = once.fireAt();
    }

    @Override
    protected void run() {
        Instant now = clock.instant();
        if (!fireAt.isAfter(now)) {
            log.warn("clock fireAt {} shouldn't be in the past! dropping task id={}", fireAt, task.taskId());
            finish();
            return;
        }
        race(Duration.between(now, fireAt), () -> {
            log.info("a once clock fired id={} description={}", task.taskId(), task.description());
            deliver();
            finish();
        });
    }

    @Override
    protected void onCancelled() {
        log.info("once clock with fireAt {} is cancelled id={}", fireAt, task.taskId());
    }
}
