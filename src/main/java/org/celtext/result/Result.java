package org.celtext.result;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of an operation that either produced a value or failed with a {@link Cause}.
 * Failures are ordinary values and never thrown.
 */
public sealed interface Result<T> {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(cause);
    }

    static Result<Unit> unitResult() {
        return new Success<>(Unit.unit());
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    <U> U fold(Function<? super Cause, ? extends U> onFailure, Function<? super T, ? extends U> onSuccess);

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if this result is a failure
     */
    T unwrap();

    Optional<Cause> cause();

    default Result<T> onFailure(Consumer<? super Cause> action) {
        cause().ifPresent(action);
        return this;
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public <U> U fold(Function<? super Cause, ? extends U> onFailure, Function<? super T, ? extends U> onSuccess) {
            return onSuccess.apply(value);
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public Optional<Cause> cause() {
            return Optional.empty();
        }
    }

    record Failure<T>(Cause reason) implements Result<T> {
        public Failure {
            Objects.requireNonNull(reason, "reason");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(reason);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Failure<>(reason);
        }

        @Override
        public <U> U fold(Function<? super Cause, ? extends U> onFailure, Function<? super T, ? extends U> onSuccess) {
            return onFailure.apply(reason);
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Attempt to unwrap failure: " + reason.message());
        }

        @Override
        public Optional<Cause> cause() {
            return Optional.of(reason);
        }
    }
}
