package io.reminder4j.core;

import java.util.Objects;

/**
 * What a {@link io.reminder4j.Notifier} is asked to render.
 *
 * @param summary   title line
 * @param body      text, usually the task description
 * @param imagePath optional icon, may be null
 * @param soundPath optional sound file, may be null
 */
public record Notification(
        String summary,
        String body,
        String imagePath,
        String soundPath
) {
    public Notification {
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    public static Notification of(String summary, Task task) {
        return new Notification(summary, task.description(), task.imagePath(), task.soundPath());
    }
}
