package com.bastion.security;

import java.util.function.Function;

/**
 * Result of an admission step: either a value or an {@link AdmissionError}.
 * <p>
 * Steps return outcomes instead of throwing so the pipeline can stop at the first failure and
 * report it without unwinding.
 *
 * @param <T> success value type
 */
public sealed interface Outcome<T> permits Outcome.Success, Outcome.Failure {

    static <T> Outcome<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Outcome<T> failure(AdmissionError error) {
        return new Failure<>(error);
    }

    static <T> Outcome<T> failure(ErrorCode code, String detail) {
        return new Failure<>(AdmissionError.of(code, detail));
    }

    boolean isSuccess();

    /**
     * @throws IllegalStateException if this is a failure
     */
    T value();

    /**
     * @throws IllegalStateException if this is a success
     */
    AdmissionError error();

    default <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (isSuccess()) {
            return success(mapper.apply(value()));
        }
        return failure(error());
    }

    default <R> Outcome<R> flatMap(Function<? super T, Outcome<R>> mapper) {
        if (isSuccess()) {
            return mapper.apply(value());
        }
        return failure(error());
    }

    record Success<T>(T value) implements Outcome<T> {

        public Success {
            if (value == null) {
                throw new IllegalArgumentException("value must not be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public AdmissionError error() {
            throw new IllegalStateException("Success has no error");
        }
    }

    record Failure<T>(AdmissionError error) implements Outcome<T> {

        public Failure {
            if (error == null) {
                throw new IllegalArgumentException("error must not be null");
            }
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T value() {
            throw new IllegalStateException("Failure has no value: " + error.code());
        }
    }
}
