package io.reminder4j.internal;

import io.reminder4j.core.Task;
import io.reminder4j.core.TaskStore;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link TaskStore}. Contents are lost on restart.
 */
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentHashMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        tasks.put(task.taskId(), task);
    }

    @Override
    public Optional<Task> find(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return Optional.ofNullable(tasks.get(taskId));
    }

    @Override
    public Optional<Task> remove(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return Optional.ofNullable(tasks.remove(taskId));
    }

    @Override
    public List<Task> list() {
        return tasks.values().stream()
                .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::taskId))
                .toList();
    }

    @Override
    public long clear() {
        long count = 0;
        for (String taskId : List.copyOf(tasks.keySet())) {
            if (tasks.remove(taskId) != null) {
                count++;
            }
        }
        return count;
    }
}
