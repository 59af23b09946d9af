package io.reminder4j.protocol;

import io.reminder4j.ReminderScheduler;
import io.reminder4j.core.SchedulerUnavailableException;
import io.reminder4j.core.Task;
import io.reminder4j.core.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;

/**
 * Daemon-side request handler: turns {@link Request}s into scheduler calls and task registry
 * updates.
 */
public class ReminderService {
    private static final Logger log = LoggerFactory.getLogger(ReminderService.class);

    private final ReminderScheduler scheduler;
    private final TaskStore taskStore;
    private final Clock clock;
    private final String defaultImagePath;
    private final String defaultSoundPath;

    public ReminderService(ReminderScheduler scheduler, TaskStore taskStore) {
        this(scheduler, taskStore, Clock.systemUTC(), null, null);
    }

    public ReminderService(
            ReminderScheduler scheduler,
            TaskStore taskStore,
            Clock clock,
            String defaultImagePath,
            String defaultSoundPath
    ) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.taskStore = Objects.requireNonNull(taskStore, "taskStore must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.defaultImagePath = defaultImagePath;
        this.defaultSoundPath = defaultSoundPath;
    }

    public Response handle(Request request) {
        Objects.requireNonNull(request, "request must not be null");
        try {
            if (request instanceof Request.Add add) {
                return add(add);
            }
            if (request instanceof Request.Cancel cancel) {
                return cancel(cancel.taskId());
            }
            return new Response.GetTasks(taskStore.list());
        } catch (SchedulerUnavailableException e) {
            log.error("scheduler unavailable while handling {} msg={}", request, e.getMessage());
            return new Response.Fail(e.getMessage());
        }
    }

    private Response add(Request.Add add) {
        Task task = Task.create(
                add.description(),
                add.clockType(),
                add.imagePath() != null ? add.imagePath() : defaultImagePath,
                add.soundPath() != null ? add.soundPath() : defaultSoundPath,
                clock.instant()
        );
        taskStore.save(task);
        try {
            scheduler.addTask(task);
        } catch (SchedulerUnavailableException e) {
            taskStore.remove(task.taskId());
            throw e;
        }
        log.info("task added id={} clock={} description={}", task.taskId(), task.clockType(), task.description());
        return new Response.AddSuccess(task.taskId());
    }

    private Response cancel(String taskId) {
        Optional<Task> task = taskStore.find(taskId);
        if (task.isEmpty()) {
            log.warn("cancel requested for unknown task id={}", taskId);
            return new Response.Fail("no task with id " + taskId);
        }
        scheduler.cancelTask(task.get());
        taskStore.remove(taskId);
        log.info("task removed id={}", taskId);
        return new Response.RemoveSuccess(taskId);
    }
}
