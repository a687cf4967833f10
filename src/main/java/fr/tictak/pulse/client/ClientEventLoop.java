package fr.tictak.pulse.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * The single thread on which every client-side state change runs. Tasks never overlap and run in submission
 * order, so the store and the connection manager need no locking.
 */
public class ClientEventLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ClientEventLoop.class);

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public ClientEventLoop(String name) {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            loopThread = thread;
            return thread;
        });
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    public boolean isClosed() {
        return executor.isShutdown();
    }

    public void execute(Runnable task) {
        try {
            executor.execute(guarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop closed, dropping task");
        }
    }

    public <T> CompletableFuture<T> submit(Callable<T> task) {
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(task.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Runs the task on the loop and waits for it. Runs inline when already on the loop or once the loop is closed.
     */
    public void runAndWait(Runnable task) {
        if (inLoop() || isClosed()) {
            task.run();
            return;
        }
        try {
            submit(() -> {
                task.run();
                return null;
            }).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RejectedExecutionException) {
                task.run();
            } else {
                log.error("Event loop task failed", e.getCause());
            }
        }
    }

    public ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return executor.schedule(guarded(task), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            executor.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Unhandled error in client event loop task", e);
            }
        };
    }
}
