package io.reminder4j.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import io.reminder4j.core.Task;

import java.util.List;

/**
 * Daemon to client message.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Response.AddSuccess.class, name = "addSuccess"),
        @JsonSubTypes.Type(value = Response.RemoveSuccess.class, name = "removeSuccess"),
        @JsonSubTypes.Type(value = Response.Fail.class, name = "fail"),
        @JsonSubTypes.Type(value = Response.GetTasks.class, name = "getTasks")
})
public sealed interface Response permits Response.AddSuccess, Response.RemoveSuccess, Response.Fail, Response.GetTasks {

    record AddSuccess(String taskId) implements Response {
    }

    record RemoveSuccess(String taskId) implements Response {
    }

    record Fail(String message) implements Response {
    }

    record GetTasks(List<Task> tasks) implements Response {
        public GetTasks {
            tasks = tasks == null ? List.of() : List.copyOf(tasks);
        }
    }
}
