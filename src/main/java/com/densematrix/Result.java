package com.densematrix;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a {@link MatrixError}.  Used where a failure has to
 * say why (bad index, singular pivot, zero divisor); plain shape failures
 * use {@link Optional} instead.
 */
public final class Result<T> {
    private final T value;
    private final MatrixError error;

    private Result(T value, MatrixError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> Result<T> failure(MatrixError error) {
        return new Result<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> Result<T> failure(MatrixError.Kind kind, String message) {
        return failure(MatrixError.of(kind, message));
    }

    public boolean isSuccess() { return error == null; }
    public boolean isFailure() { return error != null; }

    /** Returns the value, or throws {@link NoSuchElementException} carrying the error text. */
    public T get() {
        if (error != null) throw new NoSuchElementException(error.toString());
        return value;
    }

    public T orElse(T other) { return error == null ? value : other; }

    /** Returns the error, or throws {@link NoSuchElementException} on success. */
    public MatrixError error() {
        if (error == null) throw new NoSuchElementException("Result is a success");
        return error;
    }

    public Optional<T> toOptional() { return Optional.ofNullable(value); }

    public <U> Result<U> map(Function<? super T, ? extends U> f) {
        Objects.requireNonNull(f);
        return error == null ? success(f.apply(value)) : failure(error);
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> f) {
        Objects.requireNonNull(f);
        return error == null ? Objects.requireNonNull(f.apply(value)) : failure(error);
    }

    @Override public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Result)) return false;
        Result<?> o = (Result<?>) obj;
        return Objects.equals(value, o.value) && Objects.equals(error, o.error);
    }

    @Override public int hashCode() { return Objects.hash(value, error); }

    @Override public String toString() {
        return error == null ? "Success(" + value + ")" : "Failure(" + error + ")";
    }
}
