package fr.tictak.pulse.client.resilience;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.Supplier;

/**
 * Runs remote calls with retry. Attempts run on the I/O executor and the waits between them are scheduled, so no
 * thread sleeps and a disposed scope stops the loop before the next attempt.
 */
public class ResilientExecutor {

    private static final Logger log = LoggerFactory.getLogger(ResilientExecutor.class);

    private final ErrorClassifier classifier;
    private final ScheduledExecutorService scheduler;
    private final Executor ioExecutor;

    public ResilientExecutor(ErrorClassifier classifier, ScheduledExecutorService scheduler, Executor ioExecutor) {
        this.classifier = classifier;
        this.scheduler = scheduler;
        this.ioExecutor = ioExecutor;
    }

    /**
     * Retries transient failures of {@code operation} following {@code policy}. Any other failure completes the
     * returned future at once. Disposing {@code scope} cancels the returned future immediately.
     */
    public <T> CompletableFuture<T> retryWithBackoff(String name, Callable<T> operation, RetryPolicy policy,
                                                     SessionScope scope) {
        CompletableFuture<T> result = scope.track(new CompletableFuture<>());
        if (result.isDone()) {
            return result;
        }

        Retry retry = Retry.of(name, RetryConfig.custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(policy.intervalFunction())
                .retryOnException(classifier::isTransient)
                .build());
        retry.getEventPublisher().onRetry(event -> log.debug("{}: attempt {} failed, retrying in {}: {}",
                name, event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "-"));

        Supplier<CompletionStage<T>> attempt = () -> {
            if (scope.isDisposed()) {
                return CompletableFuture.failedFuture(new CancellationException("Scope disposed"));
            }
            return CompletableFuture.supplyAsync(() -> call(operation), ioExecutor);
        };

        Retry.decorateCompletionStage(retry, scheduler, attempt).get()
                .whenComplete((value, error) -> {
                    if (error == null) {
                        result.complete(value);
                    } else {
                        Throwable cause = ErrorClassifier.unwrap(error);
                        if (!(cause instanceof CancellationException)) {
                            log.debug("{} failed ({}): {}", name, classifier.classify(cause), cause.getMessage());
                        }
                        result.completeExceptionally(cause);
                    }
                });
        return result;
    }

    private static <T> T call(Callable<T> operation) {
        try {
            return operation.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CompletionException(e);
        }
    }
}
