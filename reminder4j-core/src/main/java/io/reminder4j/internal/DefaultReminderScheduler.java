package io.reminder4j.internal;

import io.reminder4j.Notifier;
import io.reminder4j.ReminderScheduler;
import io.reminder4j.core.SchedulerOptions;
import io.reminder4j.core.SchedulerUnavailableException;
import io.reminder4j.core.Task;
import io.reminder4j.core.TaskCompletionListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-process reminder scheduler.
 *
 * <p>Threads:
 * <ul>
 *   <li>{@code reminder.coordinator}: consumes commands and is the only owner of the
 *       cancellation registry</li>
 *   <li>{@code reminder.timer}: runs every timer behavior; one thread for all tasks</li>
 *   <li>{@code reminder.completion}: runs the {@link TaskCompletionListener}, so a slow store
 *       never holds up the coordinator</li>
 * </ul>
 *
 * <p>The mailbox holds at most {@link SchedulerOptions#commandCapacity()} caller commands. Once the
 * coordinator terminates, for whatever reason, every later call fails with
 * {@link SchedulerUnavailableException}; callers already blocked on a full mailbox are woken and
 * fail the same way.
 */
public class DefaultReminderScheduler implements ReminderScheduler {
    private static final Logger log = LoggerFactory.getLogger(DefaultReminderScheduler.class);

    private final SchedulerOptions options;
    private final Notifier notifier;
    private final TaskCompletionListener completionListener;
    private final Clock clock;
    private final ScheduledExecutorService timerExecutor;
    private final ExecutorService completionExecutor;

    private final BlockingQueue<SchedulerCommand> mailbox = new LinkedBlockingQueue<>();
    private final Semaphore capacity;
    private final Object stateLock = new Object();
    private volatile boolean terminated = false;

    // coordinator thread only
    private final Map<String, Registration> registry = new HashMap<>();

    private final Thread coordinatorThread;

    private record Registration(Task task, CancelSignal signal) {
    }

    public DefaultReminderScheduler(SchedulerOptions options, Notifier notifier) {
        this(options, notifier, TaskCompletionListener.NOOP);
    }

    public DefaultReminderScheduler(SchedulerOptions options, Notifier notifier, TaskCompletionListener completionListener) {
        this(options, notifier, completionListener, Clock.systemUTC(), newTimerExecutor());
    }

    /**
     * @param timerExecutor must run on exactly one thread; timer state is confined to it
     */
    DefaultReminderScheduler(
            SchedulerOptions options,
            Notifier notifier,
            TaskCompletionListener completionListener,
            Clock clock,
            ScheduledExecutorService timerExecutor
    ) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.notifier = Objects.requireNonNull(notifier, "notifier must not be null");
        this.completionListener = Objects.requireNonNull(completionListener, "completionListener must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.timerExecutor = Objects.requireNonNull(timerExecutor, "timerExecutor must not be null");
        this.capacity = new Semaphore(options.commandCapacity());
        this.completionExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r);
            t.setName("reminder.completion");
            t.setDaemon(true);
            return t;
        });

        log.info("Reminder scheduler starting with commandCapacity={}, utcOffset={}, dailyPollInterval={}",
                options.commandCapacity(),
                options.utcOffset(),
                options.dailyPollInterval());

        coordinatorThread = new Thread(this::coordinateLoop);
        coordinatorThread.setName("reminder.coordinator");
        coordinatorThread.setDaemon(true);
        coordinatorThread.start();
    }

    private static ScheduledExecutorService newTimerExecutor() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r);
            t.setName("reminder.timer");
            t.setDaemon(true);
            return t;
        });
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    @Override
    public void addTask(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        submit(new SchedulerCommand.Add(task));
        log.debug("successfully sent new task to coordinator id={} clock={}", task.taskId(), task.clockType());
    }

    @Override
    public void cancelTask(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        submit(new SchedulerCommand.Cancel(task.taskId()));
        log.debug("successfully sent cancel to coordinator id={}", task.taskId());
    }

    @Override
    public boolean isAvailable() {
        return !terminated;
    }

    /**
     * Stop every live task, then terminate the coordinator and the timer thread.
     */
    @Override
    public void close() {
        synchronized (stateLock) {
            if (!terminated) {
                mailbox.add(new SchedulerCommand.Shutdown());
            }
        }
        if (Thread.currentThread() != coordinatorThread) {
            try {
                coordinatorThread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        timerExecutor.shutdownNow();
        completionExecutor.shutdown();
    }

    private void submit(SchedulerCommand command) {
        if (terminated) {
            throw unavailable();
        }
        try {
            capacity.acquire();
        } catch (InterruptedException e) {
            // the scheduler itself keeps running; isAvailable() still reports true
            Thread.currentThread().interrupt();
            throw new SchedulerUnavailableException("interrupted while waiting for room in the scheduler mailbox", e);
        }
        synchronized (stateLock) {
            if (terminated) {
                capacity.release();
                throw unavailable();
            }
            mailbox.add(command);
        }
    }

    private static SchedulerUnavailableException unavailable() {
        return new SchedulerUnavailableException("the reminder scheduler has terminated");
    }

    private void coordinateLoop() {
        log.info("Reminder coordinator started.");
        try {
            while (true) {
                SchedulerCommand command = mailbox.take();
                if (command.holdsPermit()) {
                    capacity.release();
                }
                if (command instanceof SchedulerCommand.Shutdown) {
                    stopAll();
                    break;
                }
                handle(command);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reminder coordinator interrupted.");
        } catch (RuntimeException e) {
            log.error("Reminder coordinator terminated unexpectedly msg={}", e.getMessage(), e);
        } finally {
            terminate();
        }
    }

    private void handle(SchedulerCommand command) {
        if (command instanceof SchedulerCommand.Add add) {
            register(add.task());
        } else if (command instanceof SchedulerCommand.Cancel cancel) {
            cancel(cancel.taskId());
        } else if (command instanceof SchedulerCommand.Finished done) {
            finished(done.taskId(), done.signal());
        }
    }

    private void register(Task task) {
        String taskId = task.taskId();
        if (registry.containsKey(taskId)) {
            log.warn("task id={} is already scheduled; ignoring duplicate add", taskId);
            return;
        }
        log.info("add new clock task id={} clock={}", taskId, task.clockType().describe(options.utcOffset()));

        CancelSignal signal = new CancelSignal();
        TimerBehavior timer = TimerBehavior.forTask(task, new TimerBehavior.Context(
                signal,
                timerExecutor,
                notifier,
                clock,
                options,
                this::postFinished
        ));
        registry.put(taskId, new Registration(task, signal));
        // RejectedExecutionException here means the timer thread is gone: let the loop die with it
        timer.start();
    }

    private void cancel(String taskId) {
        Registration registration = registry.remove(taskId);
        if (registration == null) {
            log.warn("fail to find cancellation signal for task id={}", taskId);
            return;
        }
        if (!registration.signal().send()) {
            log.info("task id={} already finished, nothing to cancel", taskId);
        }
    }

    private void finished(String taskId, CancelSignal signal) {
        Registration registration = registry.get(taskId);
        if (registration == null || registration.signal() != signal) {
            return;
        }
        registry.remove(taskId);
        log.debug("task id={} finished on its own, removed from registry", taskId);
        completionExecutor.execute(() -> {
            try {
                completionListener.onFinished(registration.task());
            } catch (RuntimeException e) {
                log.error("task completion listener failed id={} msg={}", taskId, e.getMessage(), e);
            }
        });
    }

    // called on the timer thread
    private void postFinished(Task task, CancelSignal signal) {
        mailbox.add(new SchedulerCommand.Finished(task.taskId(), signal));
    }

    private void stopAll() {
        log.info("Reminder scheduler stopping {} live task(s)...", registry.size());
        for (Registration registration : registry.values()) {
            registration.signal().send();
        }
        registry.clear();
    }

    private void terminate() {
        List<SchedulerCommand> discarded = new ArrayList<>();
        synchronized (stateLock) {
            terminated = true;
            mailbox.drainTo(discarded);
        }
        long dropped = discarded.stream().filter(SchedulerCommand::holdsPermit).count();
        if (dropped > 0) {
            log.warn("Reminder coordinator discarded {} pending command(s)", dropped);
        }
        // wake callers blocked on a full mailbox; they re-check the terminal state
        capacity.release(Integer.MAX_VALUE / 2);
        // completions already handed over still run
        completionExecutor.shutdown();
        log.info("Reminder coordinator stopped.");
    }
}
