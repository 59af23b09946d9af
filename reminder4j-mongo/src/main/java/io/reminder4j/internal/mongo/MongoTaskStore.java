package io.reminder4j.internal.mongo;

import io.reminder4j.core.ClockType;
import io.reminder4j.core.Task;
import io.reminder4j.core.TaskStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for the task registry.
 *
 * <p>Only the task definitions are stored, one document per task id. Running timers are owned by
 * the scheduler and are not restored from here.
 */
public class MongoTaskStore implements TaskStore {

    private final MongoTemplate mongoTemplate;

    public MongoTaskStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Insert or replace the document for {@code task.taskId()}.
     */
    @Override
    public void save(Task task) {
        Objects.requireNonNull(task, "task must not be null");
        mongoTemplate.save(toDocument(task));
    }

    @Override
    public Optional<Task> find(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        return Optional.ofNullable(mongoTemplate.findById(taskId, TaskDocument.class))
                .map(MongoTaskStore::toTask);
    }

    @Override
    public Optional<Task> remove(String taskId) {
        Objects.requireNonNull(taskId, "taskId must not be null");
        Query q = new Query(Criteria.where("_id").is(taskId));
        return Optional.ofNullable(mongoTemplate.findAndRemove(q, TaskDocument.class))
                .map(MongoTaskStore::toTask);
    }

    @Override
    public List<Task> list() {
        Query q = new Query().with(Sort.by(Sort.Order.asc("createdAt"), Sort.Order.asc("_id")));
        return mongoTemplate.find(q, TaskDocument.class).stream()
                .map(MongoTaskStore::toTask)
                .toList();
    }

    @Override
    public long clear() {
        return mongoTemplate.remove(new Query(), TaskDocument.class).getDeletedCount();
    }

    static TaskDocument toDocument(Task task) {
        TaskDocument doc = new TaskDocument();
        doc.setId(task.taskId());
        doc.setDescription(task.description());
        doc.setImagePath(task.imagePath());
        doc.setSoundPath(task.soundPath());
        doc.setCreatedAt(task.createdAt());

        ClockType clockType = task.clockType();
        doc.setClockKind(ClockKind.of(clockType));
        if (clockType instanceof ClockType.Once once) {
            doc.setFireAt(once.fireAt());
        } else if (clockType instanceof ClockType.Period period) {
            doc.setPeriod(period.period().toString());
        } else if (clockType instanceof ClockType.OncePerDay daily) {
            doc.setHour(daily.hour());
            doc.setMinute(daily.minute());
        }
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(Task)}.
     */
    static Task toTask(TaskDocument doc) {
        Objects.requireNonNull(doc, "doc must not be null");
        if (doc.getClockKind() == null) {
            throw new IllegalStateException("task document has no clockKind: " + doc.getId());
        }

        ClockType clockType = switch (doc.getClockKind()) {
            case ONCE -> new ClockType.Once(required(doc.getFireAt(), "fireAt", doc));
            case PERIOD -> new ClockType.Period(Duration.parse(required(doc.getPeriod(), "period", doc)));
            case ONCE_PER_DAY -> new ClockType.OncePerDay(required(doc.getHour(), "hour", doc), required(doc.getMinute(), "minute", doc));
        };

        return new Task(
                doc.getId(),
                doc.getDescription(),
                clockType,
                doc.getCreatedAt(),
                doc.getImagePath(),
                doc.getSoundPath()
        );
    }

    private static <V> V required(V value, String field, TaskDocument doc) {
        if (value == null) {
            throw new IllegalStateException("task document " + doc.getId() + " is missing " + field);
        }
        return value;
    }
}
