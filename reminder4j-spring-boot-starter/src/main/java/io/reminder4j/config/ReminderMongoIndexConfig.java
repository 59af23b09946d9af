package io.reminder4j.config;

import io.reminder4j.internal.mongo.TaskDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the reminder task registry.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code reminder.ensure-indexes-on-startup=true}. In production they are usually managed by
 * migrations or ops scripts.
 *
 * <h3>Indexes (collection: {@code reminder_tasks})</h3>
 * <ul>
 *   <li><b>idx_created_at</b>: { createdAt: 1 }
 *       <br/>Used by task listing, which is ordered by creation time.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.reminder_tasks.createIndex({ createdAt: 1 }, { name: "idx_created_at" });
 * </pre>
 */
public class ReminderMongoIndexConfig {

    public static final String IDX_CREATED_AT = "idx_created_at";

    private final MongoTemplate mongoTemplate;

    public ReminderMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(TaskDocument.class).ensureIndex(createdAtIndex());
    }

    public static Index createdAtIndex() {
        return new Index()
                .on("createdAt", Sort.Direction.ASC)
                .named(IDX_CREATED_AT);
    }
}
