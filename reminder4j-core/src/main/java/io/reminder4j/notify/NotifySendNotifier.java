package io.reminder4j.notify;

import io.reminder4j.Notifier;
import io.reminder4j.core.Notification;
import io.reminder4j.core.NotifyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Desktop notifications through the freedesktop {@code notify-send} command.
 *
 * <p>The image becomes the icon ({@code -i}); the sound is passed as the {@code sound-file} hint,
 * which notification daemons may or may not honour.
 */
public class NotifySendNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(NotifySendNotifier.class);

    public static final String DEFAULT_COMMAND = "notify-send";

    private final String command;
    private final Duration timeout;

    public NotifySendNotifier(Duration timeout) {
        this(DEFAULT_COMMAND, timeout);
    }

    public NotifySendNotifier(String command, Duration timeout) {
        this.command = Objects.requireNonNull(command, "command must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
    }

    @Override
    public void send(Notification notification) throws NotifyException {
        List<String> argv = commandLine(notification);
        log.debug("running {}", argv);

        Process process;
        try {
            process = new ProcessBuilder(argv)
                    .redirectErrorStream(true)
                    .redirectOutput(ProcessBuilder.Redirect.DISCARD)
                    .start();
        } catch (IOException e) {
            throw new NotifyException("fail to start " + command + ": " + e.getMessage(), e);
        }

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new NotifyException(command + " did not finish within " + timeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new NotifyException("interrupted while waiting for " + command, e);
        }

        int exit = process.exitValue();
        if (exit != 0) {
            throw new NotifyException(command + " exited with status " + exit);
        }
    }

    List<String> commandLine(Notification notification) {
        List<String> argv = new ArrayList<>();
        argv.add(command);
        argv.add("-a");
        argv.add(notification.summary());
        if (notification.imagePath() != null) {
            argv.add("-i");
            argv.add(notification.imagePath());
        }
        if (notification.soundPath() != null) {
            argv.add("-h");
            argv.add("string:sound-file:" + notification.soundPath());
        }
        argv.add(notification.summary());
        argv.add(notification.body());
        return argv;
    }
}
