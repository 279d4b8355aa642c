package com.commodity.riskengine.domain.model;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public final class RiskResult<T> {

    private final T value;
    private final RiskError error;

    private RiskResult(T value, RiskError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> RiskResult<T> success(T value) {
        return new RiskResult<>(Objects.requireNonNull(value, "value"), null);
    }

    public static <T> RiskResult<T> failure(RiskError error) {
        return new RiskResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present: " + error);
        }
        return value;
    }

    public RiskError getError() {
        if (error == null) {
            throw new NoSuchElementException("No error present");
        }
        return error;
    }

    public T orElse(T fallback) {
        return error == null ? value : fallback;
    }

    public Optional<T> toOptional() {
        return Optional.ofNullable(value);
    }

    public <R> RiskResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) return failure(error);
        return success(mapper.apply(value));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RiskResult<?> other)) return false;
        return Objects.equals(value, other.value) && error == other.error;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error);
    }

    @Override
    public String toString() {
        return error == null ? "RiskResult{value=" + value + "}" : "RiskResult{error=" + error + "}";
    }
}
