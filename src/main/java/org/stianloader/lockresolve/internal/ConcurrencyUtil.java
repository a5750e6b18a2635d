package org.stianloader.lockresolve.internal;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.jetbrains.annotations.NotNull;

public class ConcurrencyUtil {

    @NotNull
    public static <T> CompletableFuture<T> schedule(@NotNull Callable<T> source, @NotNull Executor executor) {
        Objects.requireNonNull(source, "source may not be null");

        CompletableFuture<T> cf = new CompletableFuture<>();
        executor.execute(() -> {
            if (cf.isDone()) {
                return;
            }
            try {
                cf.complete(source.call());
            } catch (Throwable  t) {
                cf.completeExceptionally(t);
            }
        });
        return cf;
    }

    /**
     * Strips the wrappers {@link CompletableFuture} puts around exceptions thrown by its stages.
     *
     * @param t The throwable as observed on a future
     * @return The throwable that was originally thrown
     */
    @NotNull
    public static Throwable unwrap(@NotNull Throwable t) {
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
