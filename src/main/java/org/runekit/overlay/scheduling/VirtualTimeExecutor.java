package org.runekit.overlay.scheduling;

import java.util.PriorityQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeferredExecutor} driven by a simulated clock.
 * <p>
 * Nothing runs until the owner calls {@link #runPending()} or {@link #advanceBy(long)}.
 * Used for deterministic command replay and for testing timeout-driven expiry without
 * real waiting.
 * <p>
 * <b>Thread safety:</b> not thread-safe; drive it from a single thread.
 */
public class VirtualTimeExecutor implements DeferredExecutor {

    private static final Logger log = LoggerFactory.getLogger(VirtualTimeExecutor.class);

    private record Task(long dueAt, long sequence, Runnable action) implements Comparable<Task> {
        @Override
        public int compareTo(Task other) {
            int byTime = Long.compare(dueAt, other.dueAt);
            return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
        }
    }

    private final PriorityQueue<Task> tasks = new PriorityQueue<>();
    private long now;
    private long sequence;

    public VirtualTimeExecutor() {
        this(0);
    }

    /**
     * @param startMillis initial value of the simulated clock.
     */
    public VirtualTimeExecutor(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public void post(Runnable task) {
        schedule(task, 0);
    }

    @Override
    public void schedule(Runnable task, long delayMillis) {
        tasks.add(new Task(now + Math.max(0, delayMillis), sequence++, task));
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        post(() -> {
            try {
                future.complete(task.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        runPending();
        return future;
    }

    @Override
    public long currentTimeMillis() {
        return now;
    }

    /**
     * Runs every task that is due at the current simulated time, including tasks those
     * tasks post with zero delay.
     *
     * @return the number of tasks run.
     */
    public int runPending() {
        int count = 0;
        while (!tasks.isEmpty() && tasks.peek().dueAt() <= now) {
            run(tasks.poll());
            count++;
        }
        return count;
    }

    /**
     * Moves the simulated clock forward, running due tasks in time order. Each task sees
     * the clock at its own due time.
     *
     * @param millis how far to advance, must be non-negative.
     */
    public void advanceBy(long millis) {
        if (millis < 0) {
            throw new IllegalArgumentException("Cannot move time backwards: " + millis);
        }
        long target = now + millis;
        while (!tasks.isEmpty() && tasks.peek().dueAt() <= target) {
            Task task = tasks.poll();
            now = Math.max(now, task.dueAt());
            run(task);
        }
        now = target;
    }

    /**
     * @return number of tasks waiting, due or not.
     */
    public int pendingTaskCount() {
        return tasks.size();
    }

    private static void run(Task task) {
        try {
            task.action().run();
        } catch (RuntimeException e) {
            log.error("Unhandled exception in engine task", e);
        }
    }
}
