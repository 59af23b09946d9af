package io.reminder4j.core;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable reminder: what to show and when.
 *
 * <p>{@code taskId} is assigned once by {@link #create} and never reused. {@code createdAt} is
 * metadata only; scheduling is driven by {@code clockType} alone.
 */
public record Task(
        String taskId,
        String description,
        ClockType clockType,
        Instant createdAt,
        String imagePath,
        String soundPath
) {
    public Task {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(clockType, "clockType must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        if (taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
    }

    public static Task create(String description, ClockType clockType) {
        return create(description, clockType, null, null, Instant.now());
    }

    public static Task create(String description, ClockType clockType, String imagePath, String soundPath, Instant createdAt) {
        return new Task(newTaskId(), description, clockType, createdAt, blankToNull(imagePath), blankToNull(soundPath));
    }

    private static String newTaskId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 21);
    }

    private static String blankToNull(String s) {
        return (s == null || s.isBlank()) ? null : s;
    }
}
