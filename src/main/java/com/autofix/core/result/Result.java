package com.autofix.core.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Two-way outcome of a fallible operation. Exactly one of value or error is present.
 *
 * @param <T> success value type
 * @param <E> error type
 */
public sealed interface Result<T, E> permits Result.Ok, Result.Err {

    static <T, E> Result<T, E> ok(T value) {
        return new Ok<>(value);
    }

    static <T, E> Result<T, E> err(E error) {
        return new Err<>(error);
    }

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    /**
     * @throws IllegalStateException if this is an error result
     */
    T value();

    /**
     * @throws IllegalStateException if this is a success result
     */
    E error();

    default <U> Result<U, E> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Ok<T, E> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        return new Err<>(error());
    }

    default <U> Result<U, E> flatMap(Function<? super T, Result<U, E>> mapper) {
        if (this instanceof Ok<T, E> ok) {
            return mapper.apply(ok.value());
        }
        return new Err<>(error());
    }

    default T orElse(T fallback) {
        return isOk() ? value() : fallback;
    }

    record Ok<T, E>(T value) implements Result<T, E> {
        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public E error() {
            throw new IllegalStateException("Ok result has no error");
        }
    }

    record Err<T, E>(E error) implements Result<T, E> {
        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Err result has no value: " + error);
        }
    }
}
