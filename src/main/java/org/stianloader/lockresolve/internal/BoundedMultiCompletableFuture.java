package org.stianloader.lockresolve.internal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;

/**
 * A {@link CompletableFuture} that runs a task for each of its sources while keeping at most a fixed amount
 * of tasks in flight at any time. Whenever a task completes, the next pending source is dispatched.
 *
 * <p>The future completes normally with the results in the order of the sources once every task completed normally.
 * It completes exceptionally as soon as the first task fails, after which no further sources are dispatched.
 * Tasks that are already in flight at that point are left to drain and their results are discarded.
 *
 * @param <S> The type of the sources
 * @param <T> The type of the task results
 */
public class BoundedMultiCompletableFuture<S, T> extends CompletableFuture<List<T>> {

    @NotNull
    private final List<S> sources;
    @NotNull
    private final Function<S, CompletableFuture<T>> task;
    private final int concurrency;
    private final Object[] results;
    // All of the below are guarded by the monitor of this instance
    private int nextSource = 0;
    private int inFlight = 0;
    private int completions = 0;
    private boolean dispatching = false;

    public BoundedMultiCompletableFuture(@NotNull List<S> sources, int concurrency, @NotNull Function<S, CompletableFuture<T>> task) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("The concurrency cap must be at least 1, but was " + concurrency);
        }
        this.sources = new ArrayList<>(sources);
        this.task = Objects.requireNonNull(task, "task may not be null");
        this.concurrency = concurrency;
        this.results = new Object[this.sources.size()];
        if (this.sources.isEmpty()) {
            this.complete(new ArrayList<>());
        } else {
            this.dispatch();
        }
    }

    /**
     * Starts pending sources until the cap is reached or no sources remain. Only one thread runs this loop at a
     * time; completions arriving while it runs (synchronous executors complete tasks on the spot) merely free their
     * slot and leave the dispatching to the running loop, so the stack depth does not grow with the amount of sources.
     */
    private void dispatch() {
        synchronized (this) {
            if (this.dispatching) {
                return;
            }
            this.dispatching = true;
        }

        while (true) {
            int index;
            synchronized (this) {
                if (this.isDone() || this.inFlight >= this.concurrency || this.nextSource >= this.sources.size()) {
                    this.dispatching = false;
                    return;
                }
                index = this.nextSource++;
                this.inFlight++;
            }

            CompletableFuture<T> future;
            try {
                future = Objects.requireNonNull(this.task.apply(this.sources.get(index)), "task returned a null future");
            } catch (Throwable t) {
                this.sourceException(t);
                continue;
            }
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    this.sourceCompleted(index, result);
                } else {
                    this.sourceException(ex);
                }
            });
        }
    }

    @SuppressWarnings("unchecked")
    private void sourceCompleted(int index, T result) {
        synchronized (this) {
            this.inFlight--;
            if (this.isDone()) {
                return;
            }
            this.results[index] = result;
            if (++this.completions == this.results.length) {
                List<T> list = new ArrayList<>(this.results.length);
                for (Object o : this.results) {
                    list.add((T) o);
                }
                this.complete(list);
                return;
            }
        }
        this.dispatch();
    }

    private void sourceException(@NotNull Throwable exception) {
        synchronized (this) {
            this.inFlight--;
        }
        this.completeExceptionally(ConcurrencyUtil.unwrap(exception));
    }
}
