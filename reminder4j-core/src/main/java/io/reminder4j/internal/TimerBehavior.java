package io.reminder4j.internal;

import io.reminder4j.Notifier;
import io.reminder4j.core.ClockType;
import io.reminder4j.core.Notification;
import io.reminder4j.core.NotifyException;
import io.reminder4j.core.SchedulerOptions;
import io.reminder4j.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Timing routine of one task.
 *
 * <p>Every method runs on the single timer thread, so the state below is confined to it. The
 * routine only suspends inside {@link #race}: it waits for either its delay or its stop signal,
 * whichever comes first.
 */
abstract class TimerBehavior {
    private static final Logger log = LoggerFactory.getLogger(TimerBehavior.class);

    protected final Task task;
    protected final Clock clock;
    private final CancelSignal signal;
    private final ScheduledExecutorService executor;
    private final Notifier notifier;
    private final String summary;
    private final BiConsumer<Task, CancelSignal> onFinished;

    private ScheduledFuture<?> pending;
    private boolean finished = false;
    private boolean stopRequested = false;

    TimerBehavior(Task task, Context context) {
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.signal = Objects.requireNonNull(context.signal(), "signal must not be null");
        this.executor = context.executor();
        this.notifier = context.notifier();
        this.clock = context.clock();
        this.summary = context.options().summary();
        this.onFinished = context.onFinished();
    }

    /**
     * Everything a timer needs from the scheduler that spawned it.
     */
    record Context(
            CancelSignal signal,
            ScheduledExecutorService executor,
            Notifier notifier,
            Clock clock,
            SchedulerOptions options,
            BiConsumer<Task, CancelSignal> onFinished
    ) {
    }

    static TimerBehavior forTask(Task task, Context context) {
        ClockType clockType = task.clockType();
        if (clockType instanceof ClockType.Once once) {
            return new OnceTimer(task, once, context);
        }
        if (clockType instanceof ClockType.Period period) {
            return new PeriodTimer(task, period, context);
        }
        if (clockType instanceof ClockType.OncePerDay daily) {
            return new DailyTimer(task, daily, context.options().utcOffset(), context.options().dailyPollInterval(), context);
        }
        throw new IllegalArgumentException("Unsupported clock type: " + clockType);
    }

    /**
     * Hand the routine to the timer thread. Never blocks.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the timer thread is gone
     */
    final void start() {
        executor.execute(() -> {
            signal.onStop(this::stopped, executor);
            if (!finished) {
                run();
            }
        });
    }

    /**
     * Entry point, invoked once on the timer thread.
     */
    protected abstract void run();

    /**
     * Sleep for {@code delay} unless stopped first; on wake run {@code onWake}.
     */
    protected final void race(Duration delay, Runnable onWake) {
        if (finished) {
            return;
        }
        long nanos = Math.max(0L, delay.toNanos());
        pending = executor.schedule(() -> {
            pending = null;
            if (!finished) {
                onWake.run();
            }
        }, nanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Invoke the notifier once.
     *
     * @return false if delivery failed
     */
    protected final boolean deliver() {
        try {
            notifier.send(Notification.of(summary, task));
            return true;
        } catch (NotifyException | RuntimeException e) {
            log.error("fail to send notification for task id={} msg={}", task.taskId(), e.getMessage(), e);
            return false;
        }
    }

    /**
     * Stop a recurring schedule after a failed delivery by sending ourselves the stop signal.
     */
    protected final void escalate() {
        log.warn("stopping task id={} after a failed delivery; it will not fire again", task.taskId());
        stopRequested = true;
        if (!signal.send()) {
            finish();
        }
    }

    /**
     * Terminate on our own: nothing left to fire.
     */
    protected final void finish() {
        if (finished) {
            return;
        }
        finished = true;
        signal.closeReceiver();
        onFinished.accept(task, signal);
    }

    protected void onCancelled() {
        log.info("task id={} with clock {} is cancelled", task.taskId(), task.clockType());
    }

    private void stopped() {
        if (finished) {
            return;
        }
        if (pending != null) {
            pending.cancel(false);
            pending = null;
        }
        if (stopRequested) {
            finish();
            return;
        }
        finished = true;
        signal.closeReceiver();
        onCancelled();
    }
}
