package in.gts.application.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * LedgerCoordinator - Single-writer execution for every ledger operation.
 *
 * SINGLE WRITER:
 * All operations (mutations and lookups) run sequentially on one dedicated thread.
 * An operation's validation reads and its mutation writes therefore form one
 * unit that no other operation can interleave with, and no lookup can observe
 * a half-applied settlement.
 *
 * EXECUTION MODEL:
 * Callers block until their unit completes; the unit's result or exception is
 * returned to the caller unchanged. A call made from the writer thread itself
 * (e.g. a notification listener querying the ledger) runs inline.
 */
public final class LedgerCoordinator {
    private static final Logger log = LoggerFactory.getLogger(LedgerCoordinator.class);

    private static final String THREAD_NAME = "ledger-writer";

    private final ExecutorService writer;
    private volatile Thread writerThread;

    public LedgerCoordinator() {
        this.writer = Executors.newSingleThreadExecutor(runnable -> {
            Thread t = new Thread(runnable, THREAD_NAME);
            t.setDaemon(true);
            writerThread = t;
            return t;
        });

        log.info("LedgerCoordinator initialized (single writer thread)");
    }

    /**
     * Run an operation as one serialized unit and return its result.
     *
     * @param operation Operation name (for diagnostics)
     * @param task Unit of work
     * @return Task result
     * @throws RuntimeException whatever unchecked exception the task threw
     * @throws IllegalStateException if the coordinator is shut down or the caller is interrupted
     */
    public <T> T execute(String operation, Callable<T> task) {
        if (inUnit()) {
            return callInline(operation, task);
        }

        Future<T> future;
        try {
            future = writer.submit(() -> callInline(operation, task));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Ledger is shut down, rejected: " + operation, e);
        }

        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Ledger operation failed: " + operation, cause);
        }
    }

    /**
     * Run an operation that produces no result.
     */
    public void run(String operation, Runnable task) {
        execute(operation, () -> {
            task.run();
            return null;
        });
    }

    private static <T> T callInline(String operation, Callable<T> task) {
        try {
            return task.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Ledger operation failed: " + operation, e);
        }
    }

    /**
     * Shutdown the writer gracefully.
     *
     * Waits up to 30 seconds for queued operations to complete.
     */
    public void shutdown() {
        log.info("Shutting down LedgerCoordinator");

        writer.shutdown();
        try {
            if (!writer.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Ledger writer did not terminate in time, forcing shutdown");
                writer.shutdownNow();
            }
        } catch (InterruptedException e) {
            log.error("Shutdown interrupted", e);
            writer.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("LedgerCoordinator shutdown complete");
    }

    /**
     * Whether the calling thread is currently inside a ledger unit.
     */
    public boolean inUnit() {
        return Thread.currentThread() == writerThread;
    }

    public boolean isShutdown() {
        return writer.isShutdown();
    }
}
