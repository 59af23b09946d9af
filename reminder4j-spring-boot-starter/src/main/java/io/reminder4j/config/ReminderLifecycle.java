package io.reminder4j.config;

import io.reminder4j.core.TaskStore;
import io.reminder4j.protocol.ReminderServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Bridges the daemon's start/stop with the Spring container lifecycle.
 *
 * <p>On start, registry entries left over from a previous process are dropped (their timers died
 * with it) and the server starts accepting. The scheduler itself is closed when its bean is
 * destroyed.
 */
public class ReminderLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(ReminderLifecycle.class);

    private final ReminderServer server;
    private final TaskStore taskStore;
    private final boolean purgeStaleTasks;
    private volatile boolean running = false;

    public ReminderLifecycle(ReminderServer server, TaskStore taskStore, boolean purgeStaleTasks) {
        this.server = server;
        this.taskStore = taskStore;
        this.purgeStaleTasks = purgeStaleTasks;
    }

    @Override
    public void start() {
        if (purgeStaleTasks) {
            long purged = taskStore.clear();
            if (purged > 0) {
                log.warn("Dropped {} stale task(s) registered by a previous process", purged);
            }
        }
        if (server != null) {
            try {
                server.start();
            } catch (IOException e) {
                throw new UncheckedIOException("fail to start reminder server", e);
            }
        }
        running = true;
    }

    @Override
    public void stop() {
        if (server != null) {
            server.close();
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }
}
