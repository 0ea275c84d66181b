package com.ember.script.runtime;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.ember.debug.Debug;

/** {@link ScriptTimer} on a single daemon scheduler thread. */
public final class ExecutorScriptTimer implements ScriptTimer, AutoCloseable {
    private static final String TAG = "ScriptTimer";

    private final ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "ember-script-timer");
        t.setDaemon(true);
        return t;
    });

    @Override
    public Scheduled schedule(double seconds, Runnable task) {
        long millis = Math.max(0L, Math.round(seconds * 1000));
        ScheduledFuture<?> future = executor.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                Debug.get().e(TAG, "scheduled task failed", e);
            }
        }, millis, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
