package io.reminder4j.core;

import java.util.List;
import java.util.Optional;

/**
 * Registry of submitted tasks, used for listing and for resolving a task id on cancel.
 *
 * <p>This is bookkeeping only. Timers live in the scheduler and are not restored from a store.
 */
public interface TaskStore {

    void save(Task task);

    Optional<Task> find(String taskId);

    /**
     * Remove a task.
     *
     * @return the removed task, or empty if no task had this id
     */
    Optional<Task> remove(String taskId);

    /**
     * All tasks ordered by creation time, oldest first.
     */
    List<Task> list();

    /**
     * Remove every task.
     *
     * @return number of removed tasks
     */
    long clear();

    /**
     * Listener that drops tasks from this store once their schedule has ended.
     */
    default TaskCompletionListener removalListener() {
        return task -> remove(task.taskId());
    }
}
