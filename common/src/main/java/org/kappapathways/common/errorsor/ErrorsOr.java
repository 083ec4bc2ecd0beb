package org.kappapathways.common.errorsor;

import org.kappapathways.common.function.ThrowingSupplier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Used wherever every problem should be reported at once (validating a batch of stories)
 * or where a failing stage should be returned to the caller instead of thrown.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    /** All values in order, or every error of every failed item (each prefixed by its index). */
    static <T> ErrorsOr<List<T>> sequence(List<ErrorsOr<T>> items) {
        List<T> values = new ArrayList<>(items.size());
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            ErrorsOr<T> item = items.get(i);
            if (item.isError()) errors.addAll(item.addPrefixIfError("[" + i + "] ").getErrors());
            else values.add(item.getValue().get());
        }
        return errors.isEmpty() ? lift(values) : errors(errors);
    }

    /** Runs the body; an exception becomes a single error naming its type and message. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body) {
        try {
            return lift(body.get());
        } catch (Exception e) {
            return error(e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? errors(getErrors()) : lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? errors(getErrors()) : f.apply(getValue().get());
    }

    default void ifError(Consumer<? super List<String>> consumer) {
        if (isError()) consumer.accept(getErrors());
    }
}
