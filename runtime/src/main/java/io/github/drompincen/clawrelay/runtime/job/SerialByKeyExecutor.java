package io.github.drompincen.clawrelay.runtime.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Submits tasks to a shared executor such that tasks with the same key run one after another,
 * in submission order. Tasks with different keys run in parallel up to the executor's capacity.
 */
public class SerialByKeyExecutor {

    private static final Logger log = LoggerFactory.getLogger(SerialByKeyExecutor.class);

    private final Executor executor;

    /** Key to the completion future of the last task submitted under that key. */
    private final ConcurrentHashMap<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public SerialByKeyExecutor(Executor executor) {
        this.executor = Objects.requireNonNull(executor);
    }

    public CompletableFuture<Void> submit(String key, Runnable task) {
        CompletableFuture<Void> done = new CompletableFuture<>();
        // swap the tail atomically, then schedule outside any map operation: completion callbacks
        // may run on this thread and must be free to update the map
        CompletableFuture<Void> previous = tails.put(key, done);
        Runnable schedule = () -> {
            try {
                CompletableFuture.runAsync(task, executor)
                        .whenComplete((ignored, error) -> finish(key, done, error));
            } catch (RuntimeException e) {
                finish(key, done, e);
            }
        };
        if (previous == null) {
            schedule.run();
        } else {
            previous.whenComplete((r, e) -> schedule.run());
        }
        return done;
    }

    private void finish(String key, CompletableFuture<Void> done, Throwable error) {
        // remove before completing so observers never see a stale tail
        tails.remove(key, done);
        if (error != null) {
            log.error("Task for key '{}' failed", key, error);
            done.completeExceptionally(error);
        } else {
            done.complete(null);
        }
    }

    public int getActiveKeyCount() {
        return tails.size();
    }
}
