package com.typelift.basis.functional;

import java.util.function.Supplier;

/**
 * Outcome of resuming a single {@link Node}: either more work, or the final value.
 *
 * @param <T> The result type of the computation
 */
sealed interface Resumption<T> {

    /**
     * More work remains. Forcing {@code next} yields the node to resume on the following step.
     *
     * @param next Produces the next node; not yet evaluated
     */
    record More<T>(Supplier<Node<T>> next) implements Resumption<T> {}

    /**
     * The computation has reached its final value.
     *
     * @param value The final value
     */
    record Finished<T>(T value) implements Resumption<T> {}
}
