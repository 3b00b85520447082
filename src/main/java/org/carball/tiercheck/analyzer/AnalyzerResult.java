package org.carball.tiercheck.analyzer;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of one analyzer run: either the metrics or the reason the analyzer could not produce them.
 */
public sealed interface AnalyzerResult<T> {

    record Ok<T>(T value) implements AnalyzerResult<T> {
    }

    record Err<T>(String analyzer, String reason) implements AnalyzerResult<T> {
    }

    static <T> AnalyzerResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> AnalyzerResult<T> err(String analyzer, String reason) {
        return new Err<>(analyzer, reason);
    }

    /**
     * Runs {@code computation}, turning a runtime failure into an {@link Err} named after {@code analyzer}.
     */
    static <T> AnalyzerResult<T> capture(String analyzer, Supplier<T> computation) {
        try {
            return new Ok<>(computation.get());
        } catch (RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new Err<>(analyzer, reason);
        }
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    default <U> AnalyzerResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        Err<T> err = (Err<T>) this;
        return new Err<>(err.analyzer(), err.reason());
    }

    default T orElseThrow() {
        if (this instanceof Ok<T> ok) {
            return ok.value();
        }
        Err<T> err = (Err<T>) this;
        throw new IllegalStateException(err.analyzer() + " failed: " + err.reason());
    }
}
