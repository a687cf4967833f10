package fr.tictak.pulse.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs independent batch items with at most {@code concurrency} of them in flight. Extra items wait in the
 * executor queue. Results are returned in input order whatever the completion order, and one failing item never
 * fails the batch.
 */
public class BoundedWorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BoundedWorkerPool.class);

    private final ExecutorService executor;
    private final int concurrency;
    private final String name;

    public BoundedWorkerPool(String name, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be >= 1");
        }
        this.name = name;
        this.concurrency = concurrency;
        this.executor = Executors.newFixedThreadPool(concurrency, threadFactory(name));
    }

    public int getConcurrency() {
        return concurrency;
    }

    public <T, R> CompletableFuture<List<ItemResult<R>>> submitAll(List<T> items, Function<T, R> work) {
        List<CompletableFuture<ItemResult<R>>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            final int index = i;
            final T item = items.get(i);
            futures.add(CompletableFuture.supplyAsync(() -> work.apply(item), executor)
                    .handle((value, error) -> {
                        if (error == null) {
                            return ItemResult.success(index, value);
                        }
                        Throwable cause = error instanceof CompletionException && error.getCause() != null
                                ? error.getCause() : error;
                        log.warn("[{}] item {} failed: {}", name, index, cause.getMessage());
                        return ItemResult.<R>failure(index, cause);
                    }));
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> futures.stream().map(CompletableFuture::join).toList());
    }

    /**
     * Blocking variant of {@link #submitAll(List, Function)}.
     */
    public <T, R> List<ItemResult<R>> runAll(List<T> items, Function<T, R> work) {
        return submitAll(items, work).join();
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory threadFactory(String name) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, name + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record ItemResult<R>(int index, R value, Throwable error) {

        static <R> ItemResult<R> success(int index, R value) {
            return new ItemResult<>(index, value, null);
        }

        static <R> ItemResult<R> failure(int index, Throwable error) {
            return new ItemResult<>(index, null, error);
        }

        public boolean isSuccess() {
            return error == null;
        }
    }
}
