package com.hcltech.dawg.common.errorsor;

import com.hcltech.dawg.common.function.ThrowingFunction;
import com.hcltech.dawg.common.function.ThrowingSupplier;

import java.text.MessageFormat;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    /** {0} is the exception's simple class name, {1} its message. */
    static <T> ErrorsOr<T> error(String pattern, Exception e) {
        return new Error<>(List.of(MessageFormat.format(pattern, e.getClass().getSimpleName(), e.getMessage())));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    /** Wrap a throwing supplier -> ErrorsOr. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error("Evaluation error: {0}: {1}", e);
        }
    }

    /** Map + try: apply f to value (which may throw). */
    default <U> ErrorsOr<U> mapTry(ThrowingFunction<? super T, ? extends U> f) {
        if (isError()) return ErrorsOr.errors(getErrors());
        try {
            return ErrorsOr.lift(f.apply(getValue().get()));
        } catch (Exception e) {
            return ErrorsOr.error("Evaluation error: {0}: {1}", e);
        }
    }
}
