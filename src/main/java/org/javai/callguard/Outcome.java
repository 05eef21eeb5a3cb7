package org.javai.callguard;

import java.util.Objects;
import java.util.function.Function;

/**
 * The settled result of one attempt, after classification.
 * Either {@link Ok} containing a value, or {@link Fail} containing a {@link Failure}.
 *
 * <p>Outcomes are produced by {@link org.javai.callguard.boundary.Boundary}; past that point the
 * retry loop works only with classified failures, never with raw exceptions.</p>
 *
 * @param <T> The type of the successful value
 */
public sealed interface Outcome<T> permits Outcome.Ok, Outcome.Fail {

    /**
     * A successful outcome.
     *
     * @param value the successful value
     */
    record Ok<T>(T value) implements Outcome<T> {

        @Override
        public boolean isOk() {
            return true;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return value;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            Objects.requireNonNull(mapper);
            return new Ok<>(mapper.apply(value));
        }
    }

    /**
     * A failed outcome.
     *
     * @param failure the classified failure
     */
    record Fail<T>(Failure failure) implements Outcome<T> {

        public Fail {
            Objects.requireNonNull(failure, "failure must not be null");
        }

        @Override
        public boolean isOk() {
            return false;
        }

        @Override
        public T getOrElse(T defaultValue) {
            return defaultValue;
        }

        @Override
        public <U> Outcome<U> map(Function<? super T, ? extends U> mapper) {
            return new Fail<>(failure);
        }
    }

    boolean isOk();

    default boolean isFail() {
        return !isOk();
    }

    T getOrElse(T defaultValue);

    <U> Outcome<U> map(Function<? super T, ? extends U> mapper);

    static <T> Outcome<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> Outcome<T> fail(Failure failure) {
        return new Fail<>(failure);
    }
}
