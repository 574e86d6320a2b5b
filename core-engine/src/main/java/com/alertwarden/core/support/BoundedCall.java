package com.alertwarden.core.support;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a blocking collaborator call on a separate executor and waits for it
 * at most a fixed time.
 *
 * <p>
 * On timeout the call is cancelled (interrupted) and {@link TimeoutException}
 * is thrown; the caller treats it as an ordinary failure.
 * </p>
 *
 * @since 1.0.0
 */
public final class BoundedCall {

    private BoundedCall() {
        // utility class - not instantiable
    }

    /**
     * @param task     the blocking call
     * @param timeout  maximum time to wait; must be positive
     * @param executor executor that runs the call
     * @param <T>      result type
     * @return the call's result
     * @throws TimeoutException     if the call did not finish in time
     * @throws ExecutionException   if the call threw; the cause is the original
     *                              exception
     * @throws InterruptedException if the waiting thread was interrupted
     */
    public static <T> T call(Callable<T> task, Duration timeout, Executor executor)
            throws TimeoutException, ExecutionException, InterruptedException {
        Objects.requireNonNull(task, "task must not be null");
        Objects.requireNonNull(timeout, "timeout must not be null");
        Objects.requireNonNull(executor, "executor must not be null");

        FutureTask<T> future = new FutureTask<>(task);
        executor.execute(future);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
