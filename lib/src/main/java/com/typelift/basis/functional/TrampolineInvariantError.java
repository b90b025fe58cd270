package com.typelift.basis.functional;

/**
 * Thrown when the evaluator meets a computation node it does not know how to resume.
 *
 * <p>This never happens for computations built through the public {@link Trampoline} API; it
 * indicates a construction bug in the library itself and is not meant to be caught.
 */
public class TrampolineInvariantError extends Error {

    /**
     * Creates a new TrampolineInvariantError with the specified detail message.
     *
     * @param message the detail message
     */
    public TrampolineInvariantError(String message) {
        super(message);
    }
}
