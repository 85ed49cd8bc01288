package org.podtrace.lang;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Outcome of a fallible operation: either a value or a {@link Cause}.
 */
public sealed interface Result<T> {
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    Result<T> mapError(Function<? super Cause, ? extends Cause> mapper);

    <R> R fold(Function<? super Cause, ? extends R> failureMapper, Function<? super T, ? extends R> successMapper);

    Result<T> onSuccess(Consumer<? super T> action);

    Result<T> onFailure(Consumer<? super Cause> action);

    default Result<T> onSuccessRun(Runnable action) {
        return onSuccess(value -> action.run());
    }

    default Result<T> onFailureRun(Runnable action) {
        return onFailure(cause -> action.run());
    }

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Value of a successful result.
     *
     * @throws IllegalStateException if the result is a failure
     */
    T unwrap();

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(Cause cause) {
        return new Failure<>(Objects.requireNonNull(cause, "cause"));
    }

    /**
     * Run an operation that may throw and convert the thrown exception with the given mapper.
     */
    static <T> Result<T> lift(Function<? super Throwable, ? extends Cause> exceptionMapper,
                              ThrowingSupplier<? extends T> supplier) {
        try{
            return Result.<T>success(supplier.get());
        } catch (Exception e) {
            return failure(exceptionMapper.apply(e));
        }
    }

    @FunctionalInterface
    interface ThrowingSupplier<T> {
        T get() throws Exception;
    }

    record Success<T>(T value) implements Result<T> {
        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public Result<T> mapError(Function<? super Cause, ? extends Cause> mapper) {
            return this;
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> failureMapper,
                          Function<? super T, ? extends R> successMapper) {
            return successMapper.apply(value);
        }

        @Override
        public Result<T> onSuccess(Consumer<? super T> action) {
            action.accept(value);
            return this;
        }

        @Override
        public Result<T> onFailure(Consumer<? super Cause> action) {
            return this;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }
    }

    record Failure<T>(Cause cause) implements Result<T> {
        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public Result<T> mapError(Function<? super Cause, ? extends Cause> mapper) {
            return new Failure<>(mapper.apply(cause));
        }

        @Override
        public <R> R fold(Function<? super Cause, ? extends R> failureMapper,
                          Function<? super T, ? extends R> successMapper) {
            return failureMapper.apply(cause);
        }

        @Override
        public Result<T> onSuccess(Consumer<? super T> action) {
            return this;
        }

        @Override
        public Result<T> onFailure(Consumer<? super Cause> action) {
            action.accept(cause);
            return this;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Unwrapping failed result: " + cause.message());
        }
    }
}
