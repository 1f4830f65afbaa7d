package com.eainde.vendorrisk.thread;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Fan-out / fan-in over independent tasks with a per-task timeout.
 * <p>
 * Concurrency is bounded by the size of the {@link MdcAwareExecutor}. A task that fails, times out or
 * returns empty contributes nothing; the batch itself never fails. Results keep the input order, so
 * the outcome is deterministic for deterministic tasks. Tasks not yet started when {@code stop}
 * becomes true are skipped.
 */
public final class BoundedFanOut {

    private static final Logger log = LoggerFactory.getLogger(BoundedFanOut.class);

    private BoundedFanOut() {
    }

    public static <I, O> List<O> map(List<I> inputs,
                                     Function<I, Optional<O>> task,
                                     MdcAwareExecutor executor,
                                     Duration perTaskTimeout,
                                     BooleanSupplier stop) {
        if (inputs.isEmpty()) {
            return List.of();
        }
        List<CompletableFuture<Optional<O>>> futures = new ArrayList<>(inputs.size());
        for (I input : inputs) {
            CompletableFuture<Optional<O>> result = new CompletableFuture<>();
            try {
                executor.execute(() -> run(input, task, result, perTaskTimeout, stop));
            } catch (RejectedExecutionException e) {
                result.completeExceptionally(e);
            }
            futures.add(result.exceptionally(e -> {
                logFailure(input, e);
                return Optional.empty();
            }));
        }

        List<O> results = new ArrayList<>();
        for (CompletableFuture<Optional<O>> future : futures) {
            future.join().ifPresent(results::add);
        }
        return results;
    }

    private static <I, O> void run(I input, Function<I, Optional<O>> task, CompletableFuture<Optional<O>> result,
                                   Duration timeout, BooleanSupplier stop) {
        if (stop.getAsBoolean()) {
            result.complete(Optional.empty());
            return;
        }
        // the timeout starts when the task starts, not while it waits in the queue
        result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        try {
            Optional<O> value = task.apply(input);
            result.complete(value == null ? Optional.empty() : value);
        } catch (Throwable t) {
            result.completeExceptionally(t);
        }
    }

    private static void logFailure(Object input, Throwable e) {
        Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
        if (cause instanceof TimeoutException) {
            log.debug("Task for {} timed out", input);
        } else {
            log.debug("Task for {} failed: {}", input, cause.toString());
        }
    }
}
