package org.stianloader.addonresolve.internal;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import org.jetbrains.annotations.NotNull;

public final class ConcurrencyUtil {

    /**
     * Runs a task on an executor, exposing its outcome as a {@link CompletableFuture}.
     * Checked exceptions thrown by the task complete the future exceptionally with the exception as-is.
     * If the executor refuses the task the future is completed exceptionally with the
     * {@link RejectedExecutionException}.
     *
     * @param <T> The type of the task result
     * @param task The task to run
     * @param executor The executor to run the task on
     * @return A future that completes once the task finished
     */
    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> task, @NotNull Executor executor) {
        Objects.requireNonNull(task, "task may not be null");
        Objects.requireNonNull(executor, "executor may not be null");

        CompletableFuture<T> future = new CompletableFuture<>();
        try {
            executor.execute(() -> {
                if (future.isDone()) {
                    return;
                }
                try {
                    future.complete(task.call());
                } catch (Throwable t) {
                    future.completeExceptionally(t);
                }
            });
        } catch (RejectedExecutionException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    private ConcurrencyUtil() {
        throw new AssertionError();
    }
}
