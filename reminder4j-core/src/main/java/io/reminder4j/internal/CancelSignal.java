package io.reminder4j.internal;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One-shot stop message between the coordinating loop and a single timer behavior.
 */
final class CancelSignal {

    private final CompletableFuture<Void> stop = new CompletableFuture<>();
    private volatile boolean receiverClosed = false;

    /**
     * Send the stop message.
     *
     * @return false if the receiver is already gone or a stop was already sent
     */
    boolean send() {
        if (receiverClosed) {
            return false;
        }
        return stop.complete(null);
    }

    /**
     * Register the receiving side; {@code action} runs on {@code executor} once a stop arrives.
     */
    void onStop(Runnable action, Executor executor) {
        stop.thenRunAsync(action, executor);
    }

    void closeReceiver() {
        receiverClosed = true;
    }

    boolean isReceiverClosed() {
        return receiverClosed;
    }
}
