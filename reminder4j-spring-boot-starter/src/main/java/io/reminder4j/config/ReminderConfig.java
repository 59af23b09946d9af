package io.reminder4j.config;

import io.reminder4j.Notifier;
import io.reminder4j.ReminderScheduler;
import io.reminder4j.core.TaskStore;
import io.reminder4j.internal.DefaultReminderScheduler;
import io.reminder4j.internal.InMemoryTaskStore;
import io.reminder4j.internal.mongo.MongoTaskStore;
import io.reminder4j.notify.LoggingNotifier;
import io.reminder4j.notify.NotifySendNotifier;
import io.reminder4j.protocol.ProtocolMapper;
import io.reminder4j.protocol.ReminderServer;
import io.reminder4j.protocol.ReminderService;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.net.InetSocketAddress;
import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for the reminder daemon.
 *
 * <p>The task registry is Mongo-backed when a {@link MongoTemplate} bean exists, in-memory otherwise.
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration")
@ConditionalOnClass(ReminderScheduler.class)
@EnableConfigurationProperties(ReminderProperties.class)
@ConditionalOnProperty(prefix = "reminder", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReminderConfig {

    @Bean
    @ConditionalOnMissingBean
    public Notifier reminderNotifier(ReminderProperties props) {
        return switch (props.getNotifier()) {
            case LOG -> new LoggingNotifier();
            case NOTIFY_SEND -> new NotifySendNotifier(props.getNotifyTimeout());
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore(ObjectProvider<MongoTemplate> mongoTemplateProvider) {
        MongoTemplate mongoTemplate = mongoTemplateProvider.getIfAvailable();
        return mongoTemplate != null ? new MongoTaskStore(mongoTemplate) : new InMemoryTaskStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderScheduler reminderScheduler(ReminderProperties props, Notifier notifier, TaskStore taskStore) {
        return new DefaultReminderScheduler(props.toSchedulerOptions(), notifier, taskStore.removalListener());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderService reminderService(ReminderScheduler scheduler, TaskStore taskStore, ReminderProperties props) {
        return new ReminderService(
                scheduler,
                taskStore,
                Clock.systemUTC(),
                props.getDefaultImagePath(),
                props.getDefaultSoundPath()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "reminder.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ReminderServer reminderServer(ReminderService service, ReminderProperties props) {
        ReminderProperties.Server server = props.getServer();
        return new ReminderServer(
                service,
                ProtocolMapper.create(),
                new InetSocketAddress(server.getHost(), server.getPort()),
                server.getReadTimeout()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderLifecycle reminderLifecycle(ObjectProvider<ReminderServer> server, TaskStore taskStore, ReminderProperties props) {
        return new ReminderLifecycle(server.getIfAvailable(), taskStore, props.isPurgeStaleTasksOnStartup());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MongoTemplate.class)
    protected ReminderMongoIndexConfig reminderMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new ReminderMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "reminder", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton reminderIndexesInitializer(ObjectProvider<ReminderMongoIndexConfig> indexConfig) {
        return () -> indexConfig.ifAvailable(ReminderMongoIndexConfig::ensureIndexes);
    }
}
