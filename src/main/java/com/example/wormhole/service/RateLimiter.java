package com.example.wormhole.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * FIFO limiter for a rate-sensitive API: tasks run one at a time, in submission order,
 * on a single drain thread that pauses {@code delayMs} after every task.
 * <p>
 * No priority, no cancellation. The returned future completes with the task's own
 * result or exception, or is cancelled when {@link #close()} drops the task unrun.
 */
public class RateLimiter implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);

    private final String name;
    private final long delayMs;
    private final Duration closeTimeout;
    private final ExecutorService drain;

    public RateLimiter(String name, long delayMs) {
        this(name, delayMs, Duration.ofMillis(delayMs + 5_000));
    }

    public RateLimiter(String name, long delayMs, Duration closeTimeout) {
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must be >= 0");
        }
        this.name = name;
        this.delayMs = delayMs;
        this.closeTimeout = closeTimeout;
        this.drain = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limiter-" + name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Enqueues a task.
     *
     * @throws java.util.concurrent.RejectedExecutionException once the limiter is closed
     */
    public <T> CompletableFuture<T> execute(Callable<T> task) {
        QueuedTask<T> queued = new QueuedTask<>(task);
        drain.execute(queued);
        return queued.result;
    }

    public long delayMs() {
        return delayMs;
    }

    private void pause() {
        if (delayMs == 0) return;
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Stops accepting tasks and waits for the queue to drain. Tasks still queued when the
     * wait times out are dropped and their futures cancelled.
     */
    @Override
    public void close() {
        drain.shutdown();
        try {
            if (!drain.awaitTermination(closeTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                int dropped = cancelDropped(drain.shutdownNow());
                log.warn("Rate limiter '{}' did not drain in time, {} tasks dropped", name, dropped);
            }
        } catch (InterruptedException e) {
            cancelDropped(drain.shutdownNow());
            Thread.currentThread().interrupt();
        }
    }

    private static int cancelDropped(List<Runnable> dropped) {
        for (Runnable runnable : dropped) {
            if (runnable instanceof QueuedTask<?> queued) {
                queued.result.cancel(false);
            }
        }
        return dropped.size();
    }

    private final class QueuedTask<T> implements Runnable {

        private final Callable<T> task;
        private final CompletableFuture<T> result = new CompletableFuture<>();

        private QueuedTask(Callable<T> task) {
            this.task = task;
        }

        @Override
        public void run() {
            try {
                result.complete(task.call());
            } catch (Exception e) {
                result.completeExceptionally(e);
            } finally {
                pause();
            }
        }
    }
}
