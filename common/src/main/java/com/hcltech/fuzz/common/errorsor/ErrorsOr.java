package com.hcltech.fuzz.common.errorsor;

import java.util.List;
import java.util.Optional;

/**
 * Either a value or a non-empty list of error messages. Used by validators that report every
 * problem they find instead of throwing on the first one.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** Value when {@code errors} is empty, otherwise all of them. */
    static <T> ErrorsOr<T> liftOrErrors(T value, List<String> errors) {
        return errors.isEmpty() ? lift(value) : errors(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }
}
