package io.reminder4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Mongo document model for registered reminder tasks.
 *
 * <p>The clock rule is flattened: {@code clockKind} says which of {@code fireAt},
 * {@code period} or {@code hour}/{@code minute} is meaningful. The period is kept as an ISO-8601
 * duration string so nanosecond precision survives.
 */
@Document(collection = "reminder_tasks")
public class TaskDocument {

    @Id
    private String id;

    private String description;
    private ClockKind clockKind;

    private Instant fireAt;
    private String period;
    private Integer hour;
    private Integer minute;

    private String imagePath;
    private String soundPath;
    private Instant createdAt;

    public TaskDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public ClockKind getClockKind() {
        return clockKind;
    }

    public void setClockKind(ClockKind clockKind) {
        this.clockKind = clockKind;
    }

    public Instant getFireAt() {
        return fireAt;
    }

    public void setFireAt(Instant fireAt) {
        this.fireAt = fireAt;
    }

    public String getPeriod() {
        return period;
    }

    public void setPeriod(String period) {
        this.period = period;
    }

    public Integer getHour() {
        return hour;
    }

    public void setHour(Integer hour) {
        this.hour = hour;
    }

    public Integer getMinute() {
        return minute;
    }

    public void setMinute(Integer minute) {
        this.minute = minute;
    }

    public String getImagePath() {
        return imagePath;
    }

    public void setImagePath(String imagePath) {
        this.imagePath = imagePath;
    }

    public String getSoundPath() {
        return soundPath;
    }

    public void setSoundPath(String soundPath) {
        this.soundPath = soundPath;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
