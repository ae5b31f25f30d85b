package workout.logger.api.loader;

import lombok.extern.slf4j.Slf4j;
import workout.logger.api.exception.ApiException;
import workout.logger.api.exception.BackendException;
import workout.logger.api.exception.LoadCancelledException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Request-scoped loader that collapses per-parent child fetches into batched calls.
 *
 * <p>Keys passed to {@link #load} are queued until {@link #dispatch} is called; dispatch sends
 * every queued key to the {@link BatchFunction} in chunks of at most {@code maxBatchSize}.
 * A key is fetched at most once per loader instance: repeated loads share one future.
 * A failed batch fails all of its keys with the same exception.
 *
 * <p>{@link #dispatch} runs batches on the loader's executor. {@link #fetch} runs them on the
 * calling thread instead, so they join the caller's transaction and reuse its connection.
 *
 * <p>One instance serves one request and is discarded with it. Loads may come from several
 * threads; inserting a new key is serialized, looking up an existing one is not.
 *
 * @param <K> parent key
 * @param <V> child projection
 */
@Slf4j
public class BatchLoader<K, V> {
    private static final Executor CALLING_THREAD = Runnable::run;

    private final String name;
    private final BatchFunction<K, V> batchFunction;
    private final Executor executor;
    private final int maxBatchSize;

    private final ConcurrentMap<K, CompletableFuture<List<V>>> futures = new ConcurrentHashMap<>();
    private final Object lock = new Object();
    private final List<K> queuedKeys = new ArrayList<>(); // guarded by lock
    private volatile boolean cancelled;

    public BatchLoader(String name, BatchFunction<K, V> batchFunction, Executor executor, int maxBatchSize) {
        if (maxBatchSize < 1) {
            throw new IllegalArgumentException("maxBatchSize must be at least 1, got " + maxBatchSize);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.batchFunction = Objects.requireNonNull(batchFunction, "batchFunction");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.maxBatchSize = maxBatchSize;
    }

    public String getName() {
        return name;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Returns the future for {@code key}, queueing it for the next dispatch if it is new.
     * The future does not complete before {@link #dispatch} runs.
     */
    public CompletableFuture<List<V>> load(K key) {
        Objects.requireNonNull(key, "key");
        CompletableFuture<List<V>> future = futures.get(key);
        if (future != null) {
            return future;
        }
        synchronized (lock) {
            future = futures.get(key);
            if (future != null) {
                return future;
            }
            future = new CompletableFuture<>();
            futures.put(key, future);
            if (cancelled) {
                future.completeExceptionally(new LoadCancelledException(name));
            } else {
                queuedKeys.add(key);
            }
            return future;
        }
    }

    /**
     * Sends every queued key to the batch function. The returned future completes once all
     * batches of this dispatch have been delivered; it never completes exceptionally.
     */
    public CompletableFuture<Void> dispatch() {
        return dispatch(executor);
    }

    private CompletableFuture<Void> dispatch(Executor batchExecutor) {
        List<K> keys;
        synchronized (lock) {
            if (cancelled || queuedKeys.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            keys = new ArrayList<>(queuedKeys);
            queuedKeys.clear();
        }

        List<CompletableFuture<Void>> batches = new ArrayList<>();
        for (int from = 0; from < keys.size(); from += maxBatchSize) {
            int to = Math.min(from + maxBatchSize, keys.size());
            batches.add(dispatchBatch(List.copyOf(keys.subList(from, to)), batchExecutor));
        }
        return CompletableFuture.allOf(batches.toArray(new CompletableFuture[0]));
    }

    /**
     * Fails every pending load with {@link LoadCancelledException}. Queued keys are never fetched;
     * batches already running finish, but their results are dropped.
     */
    public void cancel() {
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            if (!queuedKeys.isEmpty()) {
                log.debug("Loader {} cancelled with {} undispatched keys", name, queuedKeys.size());
            }
            queuedKeys.clear();
        }
        LoadCancelledException failure = new LoadCancelledException(name);
        futures.values().forEach(future -> future.completeExceptionally(failure));
    }

    /**
     * Loads {@code keys}, runs the pending batches on the calling thread, and waits for all of them.
     * Keys already dispatched elsewhere are awaited, not fetched again.
     *
     * @return children per key in the order of {@code keys}; keys without children map to an empty list
     */
    public Map<K, List<V>> fetch(Collection<K> keys) {
        Map<K, CompletableFuture<List<V>>> pending = new LinkedHashMap<>();
        for (K key : keys) {
            pending.put(key, load(key));
        }
        dispatch(CALLING_THREAD);
        Map<K, List<V>> results = new LinkedHashMap<>();
        pending.forEach((key, future) -> results.put(key, await(future)));
        return results;
    }

    /**
     * Waits for a future from this loader and rethrows its failure unwrapped.
     * Only call after {@link #dispatch}.
     */
    public <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CancellationException e) {
            throw new LoadCancelledException(name);
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ApiException) {
                throw (ApiException) cause;
            }
            throw new BackendException("Batch load failed for loader " + name, cause);
        }
    }

    private CompletableFuture<Void> dispatchBatch(List<K> keys, Executor batchExecutor) {
        log.debug("Loader {} dispatching batch of {} keys", name, keys.size());
        CompletableFuture<Map<K, List<V>>> call;
        try {
            call = CompletableFuture.supplyAsync(() -> batchFunction.load(keys), batchExecutor);
        } catch (RejectedExecutionException e) {
            call = CompletableFuture.failedFuture(e);
        }
        return call.handle((results, error) -> {
            deliver(keys, results, error);
            return null;
        });
    }

    private void deliver(List<K> keys, Map<K, List<V>> results, Throwable error) {
        if (cancelled) {
            log.debug("Loader {} dropping results for {} keys after cancellation", name, keys.size());
        }
        if (error != null) {
            ApiException failure = toFailure(error);
            log.warn("Loader {} batch of {} keys failed: {}", name, keys.size(), failure.getMessage());
            for (K key : keys) {
                futures.get(key).completeExceptionally(failure);
            }
            return;
        }
        for (K key : keys) {
            List<V> values = results == null ? null : results.get(key);
            futures.get(key).complete(values == null ? List.of() : List.copyOf(values));
        }
    }

    private ApiException toFailure(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof ApiException) {
            return (ApiException) cause;
        }
        return new BackendException("Batch load failed for loader " + name, cause);
    }
}
