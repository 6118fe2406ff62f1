package kubi.core.model.auth;

import java.util.function.Function;

/**
 * Result of a fallible authentication step.
 *
 * <p>This is a sealed interface with two possible outcomes:
 * <ul>
 *   <li>Success: the step produced a value</li>
 *   <li>Failure: the step was rejected for a specific {@link AuthFailure}</li>
 * </ul>
 *
 * @param <T> the value produced on success
 */
public sealed interface AuthOutcome<T> {

    /**
     * The step succeeded.
     *
     * @param value the produced value
     */
    record Success<T>(T value) implements AuthOutcome<T> {
        public Success {
            if (value == null) {
                throw new IllegalArgumentException("Value cannot be null");
            }
        }
    }

    /**
     * The step was rejected.
     *
     * @param reason why it was rejected
     */
    record Failure<T>(AuthFailure reason) implements AuthOutcome<T> {
        public Failure {
            if (reason == null) {
                throw new IllegalArgumentException("Reason cannot be null");
            }
        }
    }

    static <T> AuthOutcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> AuthOutcome<T> failure(AuthFailure reason) {
        return new Failure<>(reason);
    }

    default boolean isSuccess() {
        return this instanceof Success<T>;
    }

    /**
     * Chain another fallible step onto a successful outcome.
     *
     * <p>A failure short-circuits and keeps its original reason.
     */
    default <R> AuthOutcome<R> flatMap(Function<T, AuthOutcome<R>> next) {
        if (this instanceof Success<T> success) {
            return next.apply(success.value());
        }
        return failure(((Failure<T>) this).reason());
    }

    /**
     * Return the value, or throw {@link KubiAuthenticationException} carrying the failure reason.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new KubiAuthenticationException(((Failure<T>) this).reason());
    }
}
