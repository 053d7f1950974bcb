package io.formulaflow.core.compile;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.formulaflow.core.model.CompiledFormula;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Bounded, thread-safe store of compiled formulas keyed by decoded formula text.
 *
 * <p>
 * Backed by a size-bounded Caffeine cache. Once the capacity is reached, Caffeine's W-TinyLFU
 * policy picks the entry to evict by recency and frequency, which only approximates LRU: a newly
 * added formula that is rarely used may be the one evicted. A hit returns the same {@link CompiledFormula} instance
 * every time; compile failures are never stored, so a bad formula is re-parsed (and fails again)
 * on every request.
 */
public final class ExpressionCache {

    /** Default number of compiled formulas retained. */
    public static final int DEFAULT_CAPACITY = 1024;

    private final Cache<String, CompiledFormula> cache;
    private final int capacity;

    public ExpressionCache() {
        this(DEFAULT_CAPACITY);
    }

    public ExpressionCache(int capacity) {
        this(capacity, null);
    }

    /**
     * @param capacity maximum number of compiled formulas retained, must be positive
     * @param executor executor for Caffeine's eviction maintenance, or {@code null} for the
     *                 common pool; tests pass {@code Runnable::run} to evict synchronously
     */
    ExpressionCache(int capacity, Executor executor) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
        Caffeine<Object, Object> builder = Caffeine.newBuilder().maximumSize(capacity);
        if (executor != null) {
            builder.executor(executor);
        }
        this.cache = builder.build();
    }

    /**
     * Returns the cached tree for {@code text}, compiling and storing it on a miss. Concurrent
     * misses for the same text compile once.
     *
     * @throws io.formulaflow.core.error.FormulaCompileException from {@code compiler}, in which
     *                                                           case nothing is stored
     */
    CompiledFormula get(String text, Function<String, CompiledFormula> compiler) {
        return cache.get(text, compiler);
    }

    /** The cached tree for {@code text}, or {@code null} if it is not cached. */
    public CompiledFormula getIfPresent(String text) {
        return cache.getIfPresent(text);
    }

    /** Approximate number of cached formulas. */
    public long size() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    public int capacity() {
        return capacity;
    }

    /** Drops every cached formula. */
    public void clear() {
        cache.invalidateAll();
    }
}
