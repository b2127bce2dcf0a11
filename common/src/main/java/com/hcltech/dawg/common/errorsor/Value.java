package com.hcltech.dawg.common.errorsor;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

public final class Value<T> implements ErrorsOr<T> {
    private final T value;

    Value(T value) {
        this.value = Objects.requireNonNull(value);
    }

    @Override
    public boolean isError() {
        return false;
    }

    @Override
    public boolean isValue() {
        return true;
    }

    @Override
    public Optional<T> getValue() {
        return Optional.of(value);
    }

    @Override
    public List<String> getErrors() {
        return List.of();
    }

    @Override
    public ErrorsOr<T> addPrefixIfError(String prefix) {
        return this;
    }

    @Override
    public <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError) {
        return onValue.apply(value);
    }

    @Override
    public String toString() {
        return "Value(" + value + ")";
    }
}
