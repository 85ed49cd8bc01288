package org.podtrace.lang;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Optional value without nulls in the API.
 */
public sealed interface Option<T> {
    <U> Option<U> map(Function<? super T, ? extends U> mapper);

    <U> Option<U> flatMap(Function<? super T, Option<U>> mapper);

    Option<T> filter(Predicate<? super T> predicate);

    T or(T replacement);

    T or(Supplier<? extends T> supplier);

    Option<T> onPresent(Consumer<? super T> action);

    boolean isPresent();

    default boolean isEmpty() {
        return !isPresent();
    }

    Result<T> toResult(Cause cause);

    static <T> Option<T> option(T value) {
        return value == null
               ? none()
               : some(value);
    }

    static <T> Option<T> some(T value) {
        return new Some<>(Objects.requireNonNull(value, "value"));
    }

    @SuppressWarnings("unchecked")
    static <T> Option<T> none() {
        return (Option<T>) None.INSTANCE;
    }

    record Some<T>(T value) implements Option<T> {
        @Override
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            return Option.<U>option(mapper.apply(value));
        }

        @Override
        public <U> Option<U> flatMap(Function<? super T, Option<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            return predicate.test(value)
                   ? this
                   : Option.none();
        }

        @Override
        public T or(T replacement) {
            return value;
        }

        @Override
        public T or(Supplier<? extends T> supplier) {
            return value;
        }

        @Override
        public Option<T> onPresent(Consumer<? super T> action) {
            action.accept(value);
            return this;
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public Result<T> toResult(Cause cause) {
            return Result.success(value);
        }
    }

    final class None<T> implements Option<T> {
        private static final None<?> INSTANCE = new None<>();

        private None() {}

        @Override
        public <U> Option<U> map(Function<? super T, ? extends U> mapper) {
            return Option.none();
        }

        @Override
        public <U> Option<U> flatMap(Function<? super T, Option<U>> mapper) {
            return Option.none();
        }

        @Override
        public Option<T> filter(Predicate<? super T> predicate) {
            return this;
        }

        @Override
        public T or(T replacement) {
            return replacement;
        }

        @Override
        public T or(Supplier<? extends T> supplier) {
            return supplier.get();
        }

        @Override
        public Option<T> onPresent(Consumer<? super T> action) {
            return this;
        }

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public Result<T> toResult(Cause cause) {
            return cause.result();
        }

        @Override
        public String toString() {
            return "None";
        }
    }
}
