package com.pineparser;

/**
 * Result of an operation that can succeed, fail on malformed input, or not be supported
 * at all. Callers switch on the variant instead of catching exceptions.
 */
public sealed interface ParseOutcome<T> {

    record Success<T>(T value) implements ParseOutcome<T> {}

    record SyntaxFailure<T>(ParseException error) implements ParseOutcome<T> {}

    record Unsupported<T>(String operation) implements ParseOutcome<T> {}

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * Returns the value, or throws the syntax error, or an {@link UnsupportedOperationException}.
     */
    default T orElseThrow() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        if (this instanceof SyntaxFailure<T> failure) {
            throw failure.error();
        }
        throw new UnsupportedOperationException(((Unsupported<T>) this).operation() + " is not supported");
    }
}
