package org.javai.result;

/**
 * Thrown when a value is extracted from a failed result, for example by
 * {@link Result#getOrThrow()}, and carried by {@link Try.Failure} when a result is
 * converted with {@link Result#toTry()}.
 * This is an unchecked exception because it indicates misuse of the API:
 * the caller should have checked {@link Result#isFailure()} first or used pattern matching.
 */
public class ResultFailedException extends RuntimeException {

    private final transient Object error;

    public ResultFailedException(Object error) {
        super(String.valueOf(error));
        this.error = error;
    }

    /**
     * Returns the failure value (or, for a projected success, the success value)
     * this exception was built from.
     */
    public Object error() {
        return error;
    }
}
