package io.formulaflow.core.compile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.formulaflow.core.error.FormulaSyntaxException;
import io.formulaflow.core.model.CompiledFormula;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExpressionCache}. */
@DisplayName("ExpressionCache")
class ExpressionCacheTest {

    @Test
    @DisplayName("a hit returns the identical compiled instance")
    void hitReturnsSameInstance() {
        FormulaCompiler compiler = new FormulaCompiler(new ExpressionCache());

        CompiledFormula first = compiler.compile("a + b");
        CompiledFormula second = compiler.compile("a + b");

        assertThat(second).isSameAs(first);
        assertThat(compiler.cache().getIfPresent("a + b")).isSameAs(first);
    }

    @Test
    @DisplayName("never holds more than its capacity")
    void bounded() {
        ExpressionCache cache = new ExpressionCache(8, Runnable::run);
        FormulaCompiler compiler = new FormulaCompiler(cache);

        for (int i = 0; i < 100; i++) {
            compiler.compile("x + " + i);
        }

        assertThat(cache.size()).isLessThanOrEqualTo(8);
        assertThat(cache.capacity()).isEqualTo(8);
    }

    @Test
    @DisplayName("compile failures are not cached")
    void failuresNotCached() {
        ExpressionCache cache = new ExpressionCache();
        FormulaCompiler compiler = new FormulaCompiler(cache);

        assertThatThrownBy(() -> compiler.compile("1 +")).isInstanceOf(FormulaSyntaxException.class);
        assertThatThrownBy(() -> compiler.compile("1 +")).isInstanceOf(FormulaSyntaxException.class);
        assertThat(cache.getIfPresent("1 +")).isNull();
        assertThat(cache.size()).isZero();
    }

    @Test
    @DisplayName("clear drops every entry")
    void clear() {
        ExpressionCache cache = new ExpressionCache();
        FormulaCompiler compiler = new FormulaCompiler(cache);
        compiler.compile("a");

        cache.clear();

        assertThat(cache.getIfPresent("a")).isNull();
    }

    @Test
    @DisplayName("rejects a non-positive capacity")
    void rejectsBadCapacity() {
        assertThatThrownBy(() -> new ExpressionCache(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("concurrent compiles of the same text share one tree")
    void concurrentCompiles() throws Exception {
        FormulaCompiler compiler = new FormulaCompiler(new ExpressionCache());
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            List<Callable<CompiledFormula>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                tasks.add(() -> compiler.compile("DOT(pm, qty) / NORM(qty)"));
            }
            Set<CompiledFormula> distinct = Collections.newSetFromMap(new IdentityHashMap<>());
            for (Future<CompiledFormula> f : pool.invokeAll(tasks)) {
                distinct.add(f.get());
            }
            assertThat(distinct).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
