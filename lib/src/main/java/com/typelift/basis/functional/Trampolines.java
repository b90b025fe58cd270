package com.typelift.basis.functional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Combinators over ordered collections of trampolines.
 *
 * <p>Everything here is built from {@link Trampoline#bind(Function)} alone, so the results are as
 * stack-safe as any other bind chain. Effects always run in list order.
 */
public final class Trampolines {

    private Trampolines() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * Runs each computation in order and collects their values.
     *
     * <p>Example:
     * <pre>{@code
     * Trampoline<List<Integer>> all = Trampolines.sequence(List.of(now(1), now(2), now(3)));
     * all.run(); // [1, 2, 3]
     * }</pre>
     *
     * @param trampolines the computations to run, in order
     * @return a computation producing an unmodifiable list of the values, in input order
     */
    public static <T> Trampoline<List<T>> sequence(List<? extends Trampoline<T>> trampolines) {
        Objects.requireNonNull(trampolines, "trampolines cannot be null");
        List<Trampoline<T>> snapshot = List.copyOf(trampolines);

        // Right fold: each element binds its value onto the collected tail
        Trampoline<Cons<T>> acc = Trampoline.now(null);
        for (int i = snapshot.size() - 1; i >= 0; i--) {
            Trampoline<T> head = snapshot.get(i);
            Trampoline<Cons<T>> tail = acc;
            acc = head.bind(value -> tail.map(rest -> new Cons<>(value, rest)));
        }
        return acc.map(Trampolines::toList);
    }

    /**
     * Runs each computation in order, discarding their values.
     *
     * @param trampolines the computations to run, in order
     * @return a computation producing {@code null} once every element has run
     */
    public static <T> Trampoline<Void> sequenceDiscard(List<? extends Trampoline<T>> trampolines) {
        Objects.requireNonNull(trampolines, "trampolines cannot be null");
        Trampoline<Void> acc = Trampoline.now(null);
        for (Trampoline<T> trampoline : List.copyOf(trampolines)) {
            acc = acc.then(trampoline.as(null));
        }
        return acc;
    }

    /**
     * Applies an effectful function to each element and collects the results.
     *
     * <p>{@code f} itself is applied lazily, element by element, as evaluation reaches it.
     *
     * @param f the function to apply
     * @param values the inputs, in order
     * @return a computation producing the results, in input order
     */
    public static <A, B> Trampoline<List<B>> mapM(Function<? super A, Trampoline<B>> f, List<? extends A> values) {
        Objects.requireNonNull(f, "f cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        List<Trampoline<B>> steps = new ArrayList<>(values.size());
        for (A value : values) {
            steps.add(Trampoline.later(() -> f.apply(value)));
        }
        return sequence(steps);
    }

    /**
     * {@link #mapM(Function, List)} with its arguments flipped.
     */
    public static <A, B> Trampoline<List<B>> forM(List<? extends A> values, Function<? super A, Trampoline<B>> f) {
        return mapM(f, values);
    }

    private static <T> List<T> toList(Cons<T> cons) {
        List<T> result = new ArrayList<>();
        for (Cons<T> cell = cons; cell != null; cell = cell.tail()) {
            result.add(cell.head());
        }
        return Collections.unmodifiableList(result);
    }

    private record Cons<T>(T head, Cons<T> tail) {}
}
