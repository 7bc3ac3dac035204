package io.netnotes.textarea.utils.executors;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Executor that guarantees serial execution semantics.
 * Tasks are executed one at a time in submission order, with each task
 * completing before the next begins.
 *
 * A single daemon dispatcher thread drains the queue, so a pending task never
 * keeps the JVM alive.
 */
public final class SerializedExecutor {

    private static final class Task<T> {
        final Callable<T> callable;
        final CompletableFuture<T> future;

        Task(Callable<T> callable, CompletableFuture<T> future) {
            this.callable = callable;
            this.future = future;
        }
    }

    private final BlockingQueue<Task<?>> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);
    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private final Thread dispatcher;

    public SerializedExecutor(String name) {
        dispatcher = new Thread(this::dispatchLoop, name);
        dispatcher.setDaemon(true);
        dispatcher.start();
    }

    private void dispatchLoop() {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                if (shutdown.get() && queue.isEmpty()) {
                    break;
                }
                Task<?> task = queue.poll(100, TimeUnit.MILLISECONDS);
                if (task != null) {
                    runTask(task);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            terminated.set(true);
            synchronized (this) {
                this.notifyAll();
            }
        }
    }

    private <T> void runTask(Task<T> task) {
        if (task.future.isCancelled()) {
            return;
        }

        try {
            T result = task.callable.call();
            task.future.complete(result);
        } catch (Throwable t) {
            task.future.completeExceptionally(t);
        }
    }

    /**
     * Submits a Runnable task for serial execution.
     *
     * @param runnable the task to execute
     * @return a CompletableFuture that completes when the task finishes
     */
    public CompletableFuture<Void> execute(Runnable runnable) {
        return submit(() -> {
            runnable.run();
            return null;
        });
    }

    /**
     * Submits a Callable task for serial execution.
     *
     * @param callable the task to execute
     * @return a CompletableFuture that will contain the task's result
     */
    public <T> CompletableFuture<T> submit(Callable<T> callable) {
        CompletableFuture<T> future = new CompletableFuture<>();

        if (shutdown.get()) {
            future.completeExceptionally(
                new CancellationException("Executor is shut down"));
            return future;
        }

        queue.add(new Task<>(callable, future));
        return future;
    }

    /**
     * Initiates graceful shutdown. Previously submitted tasks will execute,
     * but no new tasks will be accepted.
     */
    public void shutdown() {
        shutdown.set(true);
    }

    /**
     * Cancels queued tasks and stops the dispatcher.
     *
     * @return number of tasks that were awaiting execution
     */
    public int shutdownNow() {
        shutdown.set(true);

        List<Task<?>> notExecuted = new ArrayList<>();
        queue.drainTo(notExecuted);
        notExecuted.forEach(t -> t.future.cancel(true));

        dispatcher.interrupt();
        return notExecuted.size();
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    public boolean isTerminated() {
        return terminated.get();
    }

    /**
     * Blocks until the dispatcher has exited after a shutdown request.
     *
     * @return true if terminated, false if the timeout elapsed first
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        synchronized (this) {
            while (!terminated.get()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                TimeUnit.NANOSECONDS.timedWait(this, remaining);
            }
        }
        return true;
    }
}
