package io.reminder4j.config;

import io.reminder4j.core.SchedulerOptions;
import io.reminder4j.utils.ClockRuleParser;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;

/**
 * Runtime configuration for the reminder daemon.
 */
@ConfigurationProperties(prefix = "reminder")
public class ReminderProperties {
    private boolean enabled = true;
    private int commandCapacity = SchedulerOptions.DEFAULT_COMMAND_CAPACITY; // mailbox bound, callers block beyond it
    private String utcOffset; // e.g. "+08:00"; blank means the system offset at startup
    private Duration dailyPollInterval = SchedulerOptions.DEFAULT_DAILY_POLL_INTERVAL;
    private String summary = SchedulerOptions.DEFAULT_SUMMARY;
    private NotifierType notifier = NotifierType.LOG;
    private Duration notifyTimeout = Duration.ofSeconds(5);
    private String defaultImagePath;
    private String defaultSoundPath;
    private boolean purgeStaleTasksOnStartup = true;
    private boolean ensureIndexesOnStartup = false;
    private final Server server = new Server();

    public enum NotifierType {
        LOG,
        NOTIFY_SEND
    }

    public static class Server {
        private boolean enabled = true;
        private String host = "127.0.0.1";
        private int port = 8082;
        private Duration readTimeout = Duration.ofSeconds(5);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public Duration getReadTimeout() {
            return readTimeout;
        }

        public void setReadTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
        }
    }

    /**
     * Scheduler options derived from these properties. The offset is resolved here, once.
     */
    public SchedulerOptions toSchedulerOptions() {
        ZoneOffset offset = (utcOffset == null || utcOffset.isBlank())
                ? ClockRuleParser.systemOffset(Clock.systemDefaultZone())
                : ZoneOffset.of(utcOffset.trim());
        return new SchedulerOptions(commandCapacity, offset, dailyPollInterval, summary);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getCommandCapacity() {
        return commandCapacity;
    }

    public void setCommandCapacity(int commandCapacity) {
        this.commandCapacity = commandCapacity;
    }

    public String getUtcOffset() {
        return utcOffset;
    }

    public void setUtcOffset(String utcOffset) {
        this.utcOffset = utcOffset;
    }

    public Duration getDailyPollInterval() {
        return dailyPollInterval;
    }

    public void setDailyPollInterval(Duration dailyPollInterval) {
        this.dailyPollInterval = dailyPollInterval;
    }

    public String getSummary() {
        return summary;
    }

    public void setSummary(String summary) {
        this.summary = summary;
    }

    public NotifierType getNotifier() {
        return notifier;
    }

    public void setNotifier(NotifierType notifier) {
        this.notifier = notifier;
    }

    public Duration getNotifyTimeout() {
        return notifyTimeout;
    }

    public void setNotifyTimeout(Duration notifyTimeout) {
        this.notifyTimeout = notifyTimeout;
    }

    public String getDefaultImagePath() {
        return defaultImagePath;
    }

    public void setDefaultImagePath(String defaultImagePath) {
        this.defaultImagePath = defaultImagePath;
    }

    public String getDefaultSoundPath() {
        return defaultSoundPath;
    }

    public void setDefaultSoundPath(String defaultSoundPath) {
        this.defaultSoundPath = defaultSoundPath;
    }

    public boolean isPurgeStaleTasksOnStartup() {
        return purgeStaleTasksOnStartup;
    }

    public void setPurgeStaleTasksOnStartup(boolean purgeStaleTasksOnStartup) {
        this.purgeStaleTasksOnStartup = purgeStaleTasksOnStartup;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Server getServer() {
        return server;
    }
}
