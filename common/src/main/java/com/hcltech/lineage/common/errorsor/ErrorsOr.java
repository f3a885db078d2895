package com.hcltech.lineage.common.errorsor;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Either a value or a non-empty list of error messages. Used where every problem should be reported at once
 * rather than failing on the first one.
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

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
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
    default ErrorsOr<T> addPrefixIfError(String prefix) {
        return isError() ? ErrorsOr.errors(getErrors().stream().map(e -> prefix + e).toList()) : this;
    }

    default void ifError(Consumer<? super List<String>> consumer) {
        if (isError()) consumer.accept(getErrors());
    }
}
