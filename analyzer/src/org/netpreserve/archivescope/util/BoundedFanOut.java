package org.netpreserve.archivescope.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.*;
import java.util.function.Function;

/**
 * Runs one task per key with at most {@code width} tasks in flight and folds the results by
 * key on the calling thread. A task that returns empty or throws counts as a failure for its
 * key; the other keys are unaffected.
 */
public class BoundedFanOut implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedFanOut.class);
    private final ExecutorService executor;

    public BoundedFanOut(String threadPrefix) {
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory(threadPrefix));
    }

    /**
     * @param results  successful results keyed by input key, in input order
     * @param attempted number of distinct keys
     * @param failures keys without a result, in input order
     */
    public record Batch<T>(Map<String, T> results, int attempted, List<String> failures) {
        public int succeeded() {
            return results.size();
        }
    }

    public <T> Batch<T> run(List<String> keys, int width, Function<String, Optional<T>> task) {
        if (width < 1) throw new IllegalArgumentException("width must be at least 1");
        var distinctKeys = new ArrayList<>(new LinkedHashSet<>(keys));
        var semaphore = new Semaphore(width);
        var futures = new LinkedHashMap<String, Future<Optional<T>>>();
        for (String key : distinctKeys) {
            try {
                semaphore.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted after submitting {} of {} tasks", futures.size(), distinctKeys.size());
                break;
            }
            try {
                futures.put(key, executor.submit(() -> {
                    try {
                        return task.apply(key);
                    } finally {
                        semaphore.release();
                    }
                }));
            } catch (RejectedExecutionException e) {
                semaphore.release();
                throw e;
            }
        }

        var results = new LinkedHashMap<String, T>();
        for (var entry : futures.entrySet()) {
            try {
                entry.getValue().get().ifPresent(value -> results.put(entry.getKey(), value));
            } catch (ExecutionException e) {
                log.warn("Task for {} failed", entry.getKey(), e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted waiting for {}", entry.getKey());
            }
        }
        var failures = new ArrayList<String>();
        for (String key : distinctKeys) {
            if (!results.containsKey(key)) failures.add(key);
        }
        return new Batch<>(results, distinctKeys.size(), failures);
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
