package org.runekit.overlay.scheduling;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link DeferredExecutor} backed by a single daemon thread.
 * <p>
 * A single-consumer {@link ScheduledExecutorService} serializes every engine task, so the
 * group registries, context stack and model bindings need no locking even though commands
 * arrive on HTTP worker threads and pointer events on UI threads.
 * <p>
 * Task failures are logged and never kill the engine thread.
 * <p>
 * <b>Thread safety:</b> all methods are safe to call from any thread. {@link #close()} is
 * idempotent.
 */
public class EngineThreadExecutor implements DeferredExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EngineThreadExecutor.class);

    private final ScheduledExecutorService executor;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread engineThread;

    /**
     * Creates and starts the engine thread.
     *
     * @param threadName name of the engine thread (visible in thread dumps and logs).
     */
    public EngineThreadExecutor(String threadName) {
        ThreadFactory factory = runnable -> {
            Thread thread = new Thread(runnable, threadName);
            thread.setDaemon(true);
            engineThread = thread;
            return thread;
        };
        this.executor = Executors.newSingleThreadScheduledExecutor(factory);
    }

    @Override
    public void post(Runnable task) {
        schedule(task, 0);
    }

    @Override
    public void schedule(Runnable task, long delayMillis) {
        if (closed.get()) {
            log.debug("Engine thread closed, dropping task");
            return;
        }
        executor.schedule(guarded(task), Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
    }

    @Override
    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> future = new CompletableFuture<>();
        if (closed.get()) {
            future.completeExceptionally(new IllegalStateException("Engine thread is closed"));
            return future;
        }
        executor.execute(() -> {
            try {
                future.complete(task.call());
            } catch (Exception e) {
                future.completeExceptionally(e);
            }
        });
        return future;
    }

    @Override
    public long currentTimeMillis() {
        return System.currentTimeMillis();
    }

    /**
     * @return true if the calling thread is the engine thread.
     */
    public boolean isEngineThread() {
        return Thread.currentThread() == engineThread;
    }

    /**
     * Stops the engine thread, discarding pending and scheduled tasks.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Engine thread did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unhandled exception in engine task", e);
            }
        };
    }
}
