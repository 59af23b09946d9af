package io.reminder4j.notify;

import io.reminder4j.core.Notification;
import io.reminder4j.core.NotifyException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class NotifySendNotifierTest {

    @Test
    void commandLineCarriesIconAndSoundHint() {
        NotifySendNotifier notifier = new NotifySendNotifier(Duration.ofSeconds(1));

        List<String> argv = notifier.commandLine(new Notification("forget-me-not", "stretch", "/i.png", "/s.ogg"));

        assertEquals(List.of(
                "notify-send", "-a", "forget-me-not",
                "-i", "/i.png",
                "-h", "string:sound-file:/s.ogg",
                "forget-me-not", "stretch"), argv);
    }

    @Test
    void commandLineSkipsMissingOptions() {
        NotifySendNotifier notifier = new NotifySendNotifier(Duration.ofSeconds(1));

        List<String> argv = notifier.commandLine(new Notification("fmn", "tea", null, null));

        assertEquals(List.of("notify-send", "-a", "fmn", "fmn", "tea"), argv);
    }

    @Test
    void missingBinaryIsANotifyException() {
        NotifySendNotifier notifier = new NotifySendNotifier("reminder4j-no-such-binary", Duration.ofSeconds(1));

        assertThrows(NotifyException.class, () -> notifier.send(new Notification("fmn", "tea", null, null)));
    }
}
