import java.util.ArrayList;
import java.util.List;

import com.ember.script.runtime.ScriptTimer;

/** {@link ScriptTimer} whose tasks only run when a test fires them. */
public class ManualScriptTimer implements ScriptTimer {

    public static final class Task implements Scheduled {
        public final double seconds;
        private final Runnable runnable;
        private boolean cancelled;

        Task(double seconds, Runnable runnable) {
            this.seconds = seconds;
            this.runnable = runnable;
        }

        @Override
        public void cancel() { cancelled = true; }

        public boolean isCancelled() { return cancelled; }
    }

    private final List<Task> pending = new ArrayList<>();

    @Override
    public synchronized Scheduled schedule(double seconds, Runnable task) {
        Task t = new Task(seconds, task);
        pending.add(t);
        return t;
    }

    /** Tasks scheduled and not yet fired or cancelled. */
    public synchronized List<Task> pending() {
        List<Task> out = new ArrayList<>();
        for (Task t : pending) {
            if (!t.cancelled) out.add(t);
        }
        return out;
    }

    /** Runs the oldest live task; false when there is none. */
    public boolean fireNext() {
        Task next;
        synchronized (this) {
            next = null;
            while (!pending.isEmpty() && next == null) {
                Task t = pending.remove(0);
                if (!t.cancelled) next = t;
            }
        }
        if (next == null) return false;
        next.runnable.run();
        return true;
    }

    /** Runs a task even if it was cancelled, the way a late timer thread would. */
    public void fireIgnoringCancel(Task task) {
        synchronized (this) {
            pending.remove(task);
        }
        task.runnable.run();
    }
}
