package io.reminder4j.core;

/**
 * Callback for tasks whose schedule ended on its own (a one-shot task fired or was already due,
 * or a recurring task stopped after a failed delivery). Explicit cancellation is not reported.
 *
 * <p>Invoked in order on a dedicated scheduler thread, never on the coordinating one. A slow
 * listener (a remote store, say) only delays later completions, not new commands.
 */
@FunctionalInterface
public interface TaskCompletionListener {

    TaskCompletionListener NOOP = task -> {
    };

    void onFinished(Task task);
}
