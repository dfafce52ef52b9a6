package org.runekit.overlay.scheduling;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * The engine's single logical thread, expressed as deferred callbacks.
 * <p>
 * All overlay engine state is mutated only from tasks run by one executor. "Concurrency"
 * inside the engine means timer-scheduled continuations, never parallel execution.
 * Callers on other threads (HTTP workers, pointer listeners) hand work over via
 * {@link #post(Runnable)} or {@link #submit(Callable)}.
 * <p>
 * Tasks posted with equal due times run in submission order.
 */
public interface DeferredExecutor {

    /**
     * Runs a task on the engine thread as soon as possible, after already queued tasks.
     *
     * @param task the task to run.
     */
    void post(Runnable task);

    /**
     * Runs a task on the engine thread once the delay has elapsed. Scheduled tasks
     * cannot be cancelled; they must re-check state when they fire.
     *
     * @param task        the task to run.
     * @param delayMillis delay in milliseconds, {@code 0} behaves like {@link #post(Runnable)}.
     */
    void schedule(Runnable task, long delayMillis);

    /**
     * Runs a task on the engine thread and exposes its result.
     *
     * @param task the task to run.
     * @param <T>  the result type.
     * @return a future completed with the task's result or failure.
     */
    <T> CompletableFuture<T> submit(Callable<T> task);

    /**
     * @return the executor's notion of the current time in milliseconds.
     */
    long currentTimeMillis();
}
