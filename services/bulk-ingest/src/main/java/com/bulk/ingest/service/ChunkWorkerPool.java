package com.bulk.ingest.service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Semaphore;
import java.util.function.Consumer;
import java.util.function.Supplier;

import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import lombok.extern.slf4j.Slf4j;

/**
 * Bounded dispatcher for chunk writes, shared by every running job.
 *
 * <p>At most {@code capacity} chunks are running or waiting at once. {@link #submit} blocks the
 * calling reader until a slot frees up, which keeps the amount of buffered rows bounded no matter
 * how fast the file is read.
 *
 * <p>A slot is held until the task and its completion callback have both returned, so the
 * semaphore never reports a thread as free while it is still recording a result. The executor's
 * queue must hold at least {@code capacity} tasks; the semaphore is the only bound.
 */
@Slf4j
public class ChunkWorkerPool {

    private final ThreadPoolTaskExecutor executor;
    private final Semaphore slots;
    private final int capacity;

    public ChunkWorkerPool(ThreadPoolTaskExecutor executor, int capacity) {
        this.executor = executor;
        this.capacity = capacity;
        this.slots = new Semaphore(capacity, true);
    }

    /**
     * @throws InterruptedException if interrupted while waiting for a free slot
     */
    public <T> CompletableFuture<T> submit(Supplier<T> task) throws InterruptedException {
        return submit(task, result -> { });
    }

    /**
     * Runs {@code task} and then {@code onDone} with its result on the same worker thread. The
     * returned future completes after both, and fails if either throws.
     *
     * @throws InterruptedException if interrupted while waiting for a free slot
     */
    public <T> CompletableFuture<T> submit(Supplier<T> task, Consumer<? super T> onDone)
            throws InterruptedException {
        if (!slots.tryAcquire()) {
            log.debug("Worker pool saturated ({} slots), waiting", capacity);
            slots.acquire();
        }
        try {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    T result = task.get();
                    onDone.accept(result);
                    return result;
                } finally {
                    slots.release();
                }
            }, executor);
        } catch (TaskRejectedException e) {
            slots.release();
            throw e;
        }
    }

    public int getCapacity() {
        return capacity;
    }

    public int getAvailableSlots() {
        return slots.availablePermits();
    }

    public int getActiveWorkers() {
        return executor.getActiveCount();
    }
}
