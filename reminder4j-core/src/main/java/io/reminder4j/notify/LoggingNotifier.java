package io.reminder4j.notify;

import io.reminder4j.Notifier;
import io.reminder4j.core.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Notifier that only writes the notification to the log. Never fails.
 */
public class LoggingNotifier implements Notifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void send(Notification notification) {
        log.info("[{}] {} image={} sound={}",
                notification.summary(),
                notification.body(),
                notification.imagePath(),
                notification.soundPath());
    }
}
