package org.runekit.overlay.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.runekit.junit.extensions.logging.ExpectLog;
import org.runekit.junit.extensions.logging.LogLevel;
import org.runekit.junit.extensions.logging.LogWatchExtension;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class EngineThreadExecutorTest {

    private final EngineThreadExecutor executor = new EngineThreadExecutor("test-engine");

    @AfterEach
    void tearDown() {
        executor.close();
    }

    @Test
    void tasksRunInPostOrderOnTheEngineThread() {
        List<String> ran = new CopyOnWriteArrayList<>();
        List<String> threads = new CopyOnWriteArrayList<>();
        for (int i = 0; i < 20; i++) {
            String label = "task-" + i;
            executor.post(() -> {
                ran.add(label);
                threads.add(Thread.currentThread().getName());
            });
        }

        await().atMost(Duration.ofSeconds(5)).until(() -> ran.size() == 20);

        assertThat(ran).startsWith("task-0", "task-1").endsWith("task-19");
        assertThat(threads).containsOnly("test-engine");
    }

    @Test
    void submitCompletesOnEngineThread() throws Exception {
        CompletableFuture<Boolean> onEngine = executor.submit(executor::isEngineThread);

        assertThat(onEngine.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(executor.isEngineThread()).isFalse();
    }

    @Test
    void scheduledTaskWaitsForItsDelay() {
        AtomicBoolean fired = new AtomicBoolean();
        long start = System.currentTimeMillis();

        executor.schedule(() -> fired.set(true), 100);

        await().atMost(Duration.ofSeconds(5)).untilTrue(fired);
        assertThat(System.currentTimeMillis() - start).isGreaterThanOrEqualTo(90);
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Unhandled exception in engine task")
    void failingTaskDoesNotKillTheThread() {
        AtomicBoolean after = new AtomicBoolean();

        executor.post(() -> {
            throw new IllegalStateException("boom");
        });
        executor.post(() -> after.set(true));

        await().atMost(Duration.ofSeconds(5)).untilTrue(after);
    }

    @Test
    void closedExecutorRejectsWork() {
        executor.close();
        executor.close();

        CompletableFuture<Integer> future = executor.submit(() -> 1);

        assertThat(future).isCompletedExceptionally();
    }
}
