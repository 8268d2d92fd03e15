package com.phillippitts.collabscribe.service.session;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Serializes every mutation of session state.
 *
 * <p>Commands run one at a time in submission order on whatever thread the backing
 * {@link Executor} provides; at most one drain loop is in flight, so a multi-threaded executor or a
 * caller-runs rejection policy never breaks the ordering. Recognition events, flush ticks,
 * pause/resume and lifecycle transitions all pass through here.
 *
 * <p>A command that fails is logged and does not stop the queue. If the executor refuses the drain
 * (typically because it has been shut down) every queued command is discarded, pending
 * {@link #call} futures fail with the rejection, and the queue accepts work again.
 *
 * <p>{@link #call} from inside a running command executes inline instead of queueing; blocking on
 * a queued command from the drain thread would otherwise deadlock.
 */
public final class SessionCommandQueue {

    private static final Logger LOG = LogManager.getLogger(SessionCommandQueue.class);

    private final Executor executor;
    private final Object monitor = new Object();
    private final Queue<Runnable> pending = new ArrayDeque<>();
    private boolean draining;
    private volatile Thread drainThread;

    public SessionCommandQueue(Executor executor) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
    }

    /**
     * Enqueues a command without waiting for it.
     *
     * @param command mutation to run under serialization
     */
    public void submit(Runnable command) {
        Objects.requireNonNull(command, "command must not be null");
        synchronized (monitor) {
            pending.add(command);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RuntimeException e) {
            List<Runnable> discarded;
            synchronized (monitor) {
                discarded = new ArrayList<>(pending);
                pending.clear();
                draining = false;
            }
            LOG.error("Session command executor rejected drain, discarding {} command(s): {}",
                    discarded.size(), e.toString());
            for (Runnable dropped : discarded) {
                if (dropped instanceof PendingCall<?> droppedCall) {
                    droppedCall.fail(e);
                }
            }
            throw e;
        }
    }

    /**
     * Enqueues a command that produces a value.
     *
     * @param command work to run under serialization
     * @return future completed with the command's result or failure
     */
    public <T> CompletableFuture<T> call(Supplier<T> command) {
        Objects.requireNonNull(command, "command must not be null");
        if (Thread.currentThread() == drainThread) {
            try {
                return CompletableFuture.completedFuture(command.get());
            } catch (RuntimeException e) {
                return CompletableFuture.failedFuture(e);
            }
        }
        PendingCall<T> pendingCall = new PendingCall<>(command);
        try {
            submit(pendingCall);
        } catch (RuntimeException e) {
            pendingCall.fail(e);
        }
        return pendingCall.future;
    }

    /**
     * Checks whether the calling thread is currently draining this queue.
     */
    public boolean isDrainThread() {
        return Thread.currentThread() == drainThread;
    }

    private void drain() {
        drainThread = Thread.currentThread();
        boolean emptied = false;
        try {
            while (true) {
                Runnable next;
                synchronized (monitor) {
                    next = pending.poll();
                    if (next == null) {
                        drainThread = null;
                        draining = false;
                        emptied = true;
                        return;
                    }
                }
                runSafely(next);
            }
        } finally {
            if (!emptied) {
                // an Error escaped a command; release the queue so the next submit drains again
                synchronized (monitor) {
                    drainThread = null;
                    draining = false;
                }
            }
        }
    }

    private static final class PendingCall<T> implements Runnable {

        private final Supplier<T> command;
        private final CompletableFuture<T> future = new CompletableFuture<>();

        PendingCall(Supplier<T> command) {
            this.command = command;
        }

        @Override
        public void run() {
            try {
                future.complete(command.get());
            } catch (RuntimeException e) {
                future.completeExceptionally(e);
                throw e;
            }
        }

        void fail(Throwable cause) {
            future.completeExceptionally(cause);
        }
    }

    private static void runSafely(Runnable command) {
        try {
            command.run();
        } catch (RuntimeException e) {
            LOG.error("Session command failed", e);
        }
    }
}
