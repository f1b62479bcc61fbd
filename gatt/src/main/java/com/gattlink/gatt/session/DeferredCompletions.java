package com.gattlink.gatt.session;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Collects completions decided under a session lock so they run after it is released.
 *
 * <p>Completing a future runs the caller's continuations on the completing thread;
 * deferring keeps those continuations from executing while the lock is held.</p>
 */
final class DeferredCompletions {

    private final List<Runnable> actions = new ArrayList<>();

    <T> void complete(CompletableFuture<T> future, T value) {
        if (future != null) {
            actions.add(() -> future.complete(value));
        }
    }

    void fail(CompletableFuture<?> future, Throwable cause) {
        if (future != null) {
            actions.add(() -> future.completeExceptionally(cause));
        }
    }

    void fire() {
        for (Runnable action : actions) {
            action.run();
        }
        actions.clear();
    }
}
