package com.phillippitts.livetranslate.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared delegate executor.
 *
 * <p>Each streaming session owns one instance. All session state is touched only from tasks
 * run here, so no two tasks for the same session ever overlap, while many sessions share one
 * thread pool. A task that throws is logged and does not stall the queue.
 *
 * <p>One drain pass is handed to the delegate at a time and runs queued tasks in a loop, so a
 * delegate that runs work inline never nests tasks on the stack. The lock is never held while
 * a task runs or while the delegate is called.
 */
public final class SerialExecutor implements Executor {

    private static final Logger LOG = LogManager.getLogger(SerialExecutor.class);

    private final Executor delegate;
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private boolean draining;

    public SerialExecutor(Executor delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    /**
     * Queues {@code command}.
     *
     * @throws RejectedExecutionException if the delegate refuses the drain pass; everything
     *         queued at that moment is dropped and the executor stays usable
     */
    @Override
    public void execute(Runnable command) {
        Objects.requireNonNull(command, "command");
        synchronized (tasks) {
            tasks.add(command);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            delegate.execute(this::drain);
        } catch (RejectedExecutionException e) {
            int dropped;
            synchronized (tasks) {
                dropped = tasks.size();
                tasks.clear();
                draining = false;
            }
            LOG.warn("Delegate rejected serial tasks, dropped {}: {}", dropped, e.toString());
            throw e;
        }
    }

    private void drain() {
        boolean emptied = false;
        try {
            while (true) {
                Runnable next;
                synchronized (tasks) {
                    next = tasks.poll();
                    if (next == null) {
                        draining = false;
                        emptied = true;
                        return;
                    }
                }
                try {
                    next.run();
                } catch (RuntimeException e) {
                    LOG.error("Serial task failed: {}", e.toString(), e);
                }
            }
        } finally {
            if (!emptied) {
                // an Error escaped a task; the next execute starts a fresh pass
                synchronized (tasks) {
                    draining = false;
                }
            }
        }
    }

    /** Number of tasks waiting behind the running one. */
    public int pending() {
        synchronized (tasks) {
            return tasks.size();
        }
    }
}
