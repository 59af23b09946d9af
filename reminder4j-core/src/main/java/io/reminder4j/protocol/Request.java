package io.reminder4j.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.reminder4j.core.ClockType;

import java.util.Objects;

/**
 * Client to daemon message.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Request.Add.class, name = "add"),
        @JsonSubTypes.Type(value = Request.Cancel.class, name = "cancel"),
        @JsonSubTypes.Type(value = Request.Show.class, name = "show")
})
public sealed interface Request permits Request.Add, Request.Cancel, Request.Show {

    /**
     * Schedule a new task. Image and sound paths are optional.
     */
    record Add(String description, ClockType clockType, String imagePath, String soundPath) implements Request {
        public Add {
            Objects.requireNonNull(description, "description must not be null");
            Objects.requireNonNull(clockType, "clockType must not be null");
        }
    }

    record Cancel(String taskId) implements Request {
        public Cancel {
            Objects.requireNonNull(taskId, "taskId must not be null");
        }
    }

    /**
     * List every known task.
     */
    record Show() implements Request {
    }
}
