package com.guildauction.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared executor.
 * A failing task is logged and does not stop the tasks queued behind it.
 */
public class SerialTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(SerialTaskQueue.class);

    private final String name;
    private final Executor executor;
    private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null);

    public SerialTaskQueue(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    public synchronized CompletableFuture<Void> submit(String description, Runnable task) {
        // exceptionally() only matters when the executor rejected a previous task
        tail = tail.exceptionally(e -> null).thenRunAsync(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Queue {}: task '{}' failed: {}", name, description, e.getMessage(), e);
            }
        }, executor);
        return tail;
    }

    /** Completes once everything submitted so far has run. */
    public synchronized CompletableFuture<Void> drained() {
        return tail;
    }
}
