package com.typelift.basis.functional;

import java.util.function.Function;
import java.util.function.Supplier;

/**
 * One step of a deferred computation.
 *
 * <p>A node is one of three variants:
 * <ul>
 *   <li>{@link Done} - a terminal value</li>
 *   <li>{@link Suspend} - a deferred branch producing the next computation</li>
 *   <li>{@link Bind} - an unflattened bind: reduce {@code sub}, then feed its value to {@code k}</li>
 * </ul>
 *
 * <p>Nodes are immutable. They are built by {@link Trampoline} and consumed by its driver loop;
 * nothing outside this package reaches into them.
 *
 * @param <T> The result type of the computation
 */
sealed interface Node<T> {

    /**
     * Terminal leaf.
     *
     * @param value The final value, may be {@code null}
     */
    record Done<T>(T value) implements Node<T> {}

    /**
     * Deferred branch. The thunk is invoked at most once per run, only when the driver reaches it.
     *
     * @param thunk Produces the next computation
     */
    record Suspend<T>(Supplier<Trampoline<T>> thunk) implements Node<T> {}

    /**
     * Unflattened bind.
     *
     * <p>The intermediate type {@code S} is existential: nothing outside the node needs to know it.
     * The only contract on {@code k} is that it accepts a value produced by {@code sub} and returns
     * a node of the outer result type.
     *
     * @param sub The computation to reduce first
     * @param k The continuation receiving the value of {@code sub}
     * @param <S> The result type of {@code sub}
     */
    record Bind<S, T>(Node<S> sub, Function<? super S, Node<T>> k) implements Node<T> {}
}
