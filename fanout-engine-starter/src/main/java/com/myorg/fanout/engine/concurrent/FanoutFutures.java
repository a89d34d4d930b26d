package com.myorg.fanout.engine.concurrent;

import com.myorg.fanout.contracts.core.exception.FanoutException;
import com.myorg.fanout.contracts.core.exception.UpstreamException;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Join-barrier helpers shared by the engine.
 *
 * <p>{@link #all(Collection)} completes exceptionally with the first branch failure it sees.
 * Other branches keep running; their results are ignored.
 */
public final class FanoutFutures {

    private FanoutFutures() {}

    public static <T> CompletableFuture<T> supply(Executor executor, String what, Supplier<T> task) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return task.get();
            } catch (FanoutException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new UpstreamException(what + " failed: " + e.getMessage(), e);
            }
        }, executor);
    }

    public static CompletableFuture<Void> run(Executor executor, String what, Runnable task) {
        return supply(executor, what, () -> {
            task.run();
            return null;
        });
    }

    public static CompletableFuture<Void> all(CompletableFuture<?>... futures) {
        return all(List.of(futures));
    }

    public static CompletableFuture<Void> all(Collection<? extends CompletableFuture<?>> futures) {
        CompletableFuture<Void> barrier = new CompletableFuture<>();
        if (futures.isEmpty()) {
            barrier.complete(null);
            return barrier;
        }
        AtomicInteger remaining = new AtomicInteger(futures.size());
        for (CompletableFuture<?> f : futures) {
            f.whenComplete((v, e) -> {
                if (e != null) {
                    barrier.completeExceptionally(unwrap(e));
                } else if (remaining.decrementAndGet() == 0) {
                    barrier.complete(null);
                }
            });
        }
        return barrier;
    }

    public static CompletableFuture<Void> done() {
        return CompletableFuture.completedFuture(null);
    }

    public static Throwable unwrap(Throwable e) {
        Throwable cur = e;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        return cur;
    }
}
