package dev.ticketing.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Outcome of a fallible operation: either an {@link Ok} carrying a value or an
 * {@link Err} carrying an error.
 *
 * <p>The error type comes first, so a decision reads as
 * {@code Result<DomainError, List<TicketEvent>>}.
 *
 * <p>Usage:
 * <pre>{@code
 * Result<DomainError, List<TicketEvent>> decided = TicketAggregate.decide(cmd, state, context);
 * return decided.match(
 *     events -> TicketAggregate.evolveAll(state, events),
 *     error -> state);
 * }</pre>
 *
 * @param <E> the error type
 * @param <T> the success type
 */
public sealed interface Result<E, T> permits Result.Ok, Result.Err {

    /**
     * Successful result.
     */
    record Ok<E, T>(T value) implements Result<E, T> {
        @Override
        public boolean isOk() {
            return true;
        }
    }

    /**
     * Failed result. The error is never null.
     */
    record Err<E, T>(E error) implements Result<E, T> {
        public Err {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isOk() {
            return false;
        }
    }

    // --- Constructors ---

    static <E, T> Result<E, T> ok(T value) {
        return new Ok<>(value);
    }

    static <E, T> Result<E, T> err(E error) {
        return new Err<>(error);
    }

    // --- Guards ---

    boolean isOk();

    default boolean isErr() {
        return !isOk();
    }

    // --- Combinators ---

    /**
     * Apply {@code fn} to the success value; an {@code Err} passes through unchanged.
     */
    default <U> Result<E, U> map(Function<? super T, ? extends U> fn) {
        if (this instanceof Ok<E, T> ok) {
            return new Ok<>(fn.apply(ok.value()));
        }
        return new Err<>(((Err<E, T>) this).error());
    }

    /**
     * Apply {@code fn} to the error value; an {@code Ok} passes through unchanged.
     */
    default <F> Result<F, T> mapErr(Function<? super E, ? extends F> fn) {
        if (this instanceof Err<E, T> err) {
            return new Err<>(fn.apply(err.error()));
        }
        return new Ok<>(((Ok<E, T>) this).value());
    }

    /**
     * Chain a computation that may itself fail. Short-circuits on the first {@code Err}.
     */
    default <U> Result<E, U> flatMap(Function<? super T, ? extends Result<E, U>> fn) {
        if (this instanceof Ok<E, T> ok) {
            return fn.apply(ok.value());
        }
        return new Err<>(((Err<E, T>) this).error());
    }

    /**
     * Fold both variants into a single value.
     */
    default <R> R match(Function<? super T, ? extends R> onOk, Function<? super E, ? extends R> onErr) {
        if (this instanceof Ok<E, T> ok) {
            return onOk.apply(ok.value());
        }
        return onErr.apply(((Err<E, T>) this).error());
    }

    /**
     * Run a side effect on the success value and return this result.
     */
    default Result<E, T> tap(Consumer<? super T> action) {
        if (this instanceof Ok<E, T> ok) {
            action.accept(ok.value());
        }
        return this;
    }

    /**
     * Run a side effect on the error value and return this result.
     */
    default Result<E, T> tapErr(Consumer<? super E> action) {
        if (this instanceof Err<E, T> err) {
            action.accept(err.error());
        }
        return this;
    }

    // --- Extractors ---

    /**
     * Extract the success value.
     *
     * @throws Errors.UnwrapError if this is an {@code Err}
     */
    default T unwrap() {
        if (this instanceof Ok<E, T> ok) {
            return ok.value();
        }
        throw new Errors.UnwrapError("Called unwrap on Err: " + ((Err<E, T>) this).error());
    }

    /**
     * Extract the error value.
     *
     * @throws Errors.UnwrapError if this is an {@code Ok}
     */
    default E unwrapErr() {
        if (this instanceof Err<E, T> err) {
            return err.error();
        }
        throw new Errors.UnwrapError("Called unwrapErr on Ok: " + ((Ok<E, T>) this).value());
    }

    default T unwrapOr(T defaultValue) {
        if (this instanceof Ok<E, T> ok) {
            return ok.value();
        }
        return defaultValue;
    }

    // --- Collections ---

    /**
     * Combine results left to right into one result of a list.
     * Returns the first {@code Err} encountered; an empty input yields {@code Ok([])}.
     */
    static <E, T> Result<E, List<T>> all(List<? extends Result<E, ? extends T>> results) {
        List<T> values = new ArrayList<>(results.size());
        for (Result<E, ? extends T> result : results) {
            if (result.isErr()) {
                return new Err<>(result.unwrapErr());
            }
            values.add(result.unwrap());
        }
        return new Ok<>(Collections.unmodifiableList(values));
    }

    /**
     * Gather every error, in order. Useful when validating several fields at once.
     */
    static <E, T> List<E> collectErrors(List<? extends Result<E, ? extends T>> results) {
        List<E> errors = new ArrayList<>();
        for (Result<E, ? extends T> result : results) {
            if (result.isErr()) {
                errors.add(result.unwrapErr());
            }
        }
        return Collections.unmodifiableList(errors);
    }

    // --- Lifting ---

    /**
     * Lift a possibly-null value. Only {@code null} becomes an {@code Err};
     * {@code 0}, {@code ""} and {@code false} stay {@code Ok}.
     */
    static <E, T> Result<E, T> fromNullable(T value, Supplier<? extends E> onNull) {
        if (value == null) {
            return new Err<>(onNull.get());
        }
        return new Ok<>(value);
    }

    /**
     * Run a computation that may throw, converting anything thrown through {@code onError}.
     * Nothing escapes, {@link Error}s included.
     */
    static <E, T> Result<E, T> tryCatch(ThrowingSupplier<? extends T> body, Function<? super Throwable, ? extends E> onError) {
        T value;
        try {
            value = body.get();
        } catch (Throwable t) {
            return new Err<>(onError.apply(t));
        }
        return new Ok<>(value);
    }

    /**
     * Supplier that is allowed to throw checked exceptions.
     */
    @FunctionalInterface
    interface ThrowingSupplier<T> {
        T get() throws Exception;
    }
}
