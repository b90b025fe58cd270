package com.typelift.basis.functional;

import com.typelift.basis.config.TrampolineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * A computation that either produces a value ({@link #now}) or branches ({@link #later}), evaluated
 * in constant stack space.
 *
 * <p>Trampolines trade stack for heap: binding builds a small immutable node instead of calling the
 * continuation, and {@link #run()} forces the resulting structure with a flat loop. Left-nested binds
 * are re-associated as they are resumed, so an arbitrarily long chain such as
 * <pre>{@code
 * Trampoline<Integer> t = Trampoline.now(0);
 * for (int i = 0; i < 1_000_000; i++) {
 *     t = t.bind(x -> Trampoline.now(x + 1));
 * }
 * t.run(); // 1_000_000
 * }</pre>
 * never grows the call stack.
 *
 * <p>Based on "Stackless Scala With Free Monads" by Rúnar Óli Bjarnason.
 *
 * <p>A trampoline is immutable and may be shared freely; every call to {@link #run()} walks the
 * structure again and re-executes any captured thunks.
 *
 * @param <T> The result type
 */
public final class Trampoline<T> {

    private static final Logger logger = LoggerFactory.getLogger(Trampoline.class);

    final Node<T> node;

    private Trampoline(Node<T> node) {
        this.node = node;
    }

    // ============================================================================
    // Factory Methods
    // ============================================================================

    /**
     * Lifts a value into a trampoline. Adds a leaf to the computation tree.
     */
    public static <T> Trampoline<T> now(T value) {
        return new Trampoline<>(new Node.Done<>(value));
    }

    /**
     * Alias for {@link #now(Object)}.
     */
    public static <T> Trampoline<T> pure(T value) {
        return now(value);
    }

    /**
     * Suspends a sub-computation that yields another trampoline for evaluation later. Adds a branch
     * to the computation tree.
     *
     * <p>The thunk is not invoked here; the driver invokes it once, when it reaches this node.
     *
     * @param thunk produces the next computation
     * @return a suspended trampoline
     */
    public static <T> Trampoline<T> later(Supplier<Trampoline<T>> thunk) {
        Objects.requireNonNull(thunk, "thunk cannot be null");
        return new Trampoline<>(new Node.Suspend<>(thunk));
    }

    /**
     * Alias for {@link #later(Supplier)}.
     */
    public static <T> Trampoline<T> suspend(Supplier<Trampoline<T>> thunk) {
        return later(thunk);
    }

    /**
     * Defers a plain computation until the driver reaches it.
     */
    public static <T> Trampoline<T> delay(Supplier<? extends T> computation) {
        Objects.requireNonNull(computation, "computation cannot be null");
        return later(() -> now(computation.get()));
    }

    // ============================================================================
    // Monadic Operations
    // ============================================================================

    /**
     * Sequences this computation with one that depends on its value.
     *
     * <p>Constructs a single node; neither this computation nor {@code f} is evaluated.
     *
     * @param f the continuation receiving this computation's value
     * @return the combined computation
     */
    public <B> Trampoline<B> bind(Function<? super T, Trampoline<B>> f) {
        Objects.requireNonNull(f, "f cannot be null");
        return new Trampoline<>(new Node.Bind<T, B>(node, x -> nodeOf(f.apply(x), "bind continuation")));
    }

    /**
     * Alias for {@link #bind(Function)}.
     */
    public <B> Trampoline<B> flatMap(Function<? super T, Trampoline<B>> f) {
        return bind(f);
    }

    public <B> Trampoline<B> map(Function<? super T, ? extends B> f) {
        Objects.requireNonNull(f, "f cannot be null");
        return bind(x -> now(f.apply(x)));
    }

    /**
     * Replaces the value of this computation, keeping its effects.
     */
    public <B> Trampoline<B> as(B value) {
        return map(ignored -> value);
    }

    /**
     * Runs this computation, then {@code next}, keeping the value of {@code next}.
     */
    public <B> Trampoline<B> then(Trampoline<B> next) {
        Objects.requireNonNull(next, "next cannot be null");
        return bind(ignored -> next);
    }

    /**
     * Alias for {@link #then(Trampoline)}.
     */
    public <B> Trampoline<B> andThen(Trampoline<B> next) {
        return then(next);
    }

    /**
     * Runs this computation, then {@code next}, keeping the value of this computation.
     */
    public <B> Trampoline<T> discardThen(Trampoline<B> next) {
        Objects.requireNonNull(next, "next cannot be null");
        return bind(value -> next.as(value));
    }

    /**
     * Combines the values of this computation and {@code other}. This computation runs first.
     */
    public <B, C> Trampoline<C> map2(Trampoline<B> other, BiFunction<? super T, ? super B, ? extends C> f) {
        Objects.requireNonNull(other, "other cannot be null");
        Objects.requireNonNull(f, "f cannot be null");
        return bind(a -> other.map(b -> f.apply(a, b)));
    }

    /**
     * Applies the function produced by {@code tf} to the value produced by {@code ta}. The function's
     * computation runs first.
     */
    public static <A, B> Trampoline<B> ap(
            Trampoline<? extends Function<? super A, ? extends B>> tf,
            Trampoline<A> ta) {
        Objects.requireNonNull(tf, "tf cannot be null");
        Objects.requireNonNull(ta, "ta cannot be null");
        return tf.bind(f -> ta.map(f));
    }

    // ============================================================================
    // Evaluation
    // ============================================================================

    /**
     * Forces this computation with the default configuration.
     *
     * @return the final value
     */
    public T run() {
        return run(TrampolineConfig.defaults());
    }

    /**
     * Forces this computation to its final value.
     *
     * <p>The loop holds only the current node, so its stack usage does not depend on how many steps
     * the computation takes. A computation that suspends itself forever never returns. Exceptions
     * thrown by thunks or continuations propagate unchanged and stop evaluation at that step.
     *
     * @param config controls logging only
     * @return the final value
     */
    public T run(TrampolineConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        final String name = config.getName();
        final long progressInterval = config.getProgressLogInterval();

        if (logger.isDebugEnabled()) {
            logger.debug("Running trampoline '{}'", name);
        }

        Node<T> current = node;
        long steps = 0;
        try {
            while (true) {
                Resumption<T> step = resume(current);
                steps++;
                if (step instanceof Resumption.Finished<T> finished) {
                    if (logger.isTraceEnabled()) {
                        logger.trace("Trampoline '{}' finished after {} steps", name, steps);
                    }
                    return finished.value();
                }
                if (step instanceof Resumption.More<T> more) {
                    current = more.next().get();
                } else {
                    throw invariantViolation("resumption", step);
                }
                if (progressInterval > 0 && steps % progressInterval == 0 && logger.isDebugEnabled()) {
                    logger.debug("Trampoline '{}' has taken {} steps", name, steps);
                }
            }
        } catch (RuntimeException e) {
            logger.debug("Trampoline '{}' aborted at step {}", name, steps, e);
            throw e;
        }
    }

    /**
     * Resumes a single node.
     *
     * <p>{@code Done} yields its value. {@code Suspend} yields its thunk unevaluated. {@code Bind}
     * dispatches on its sub-computation: a finished sub defers the continuation, a suspended sub is
     * forced on the next step and rebound, and a nested bind is re-associated,
     * {@code (m >>= f) >>= g} becoming {@code m >>= (x -> f x >>= g)}, and resumed in place. Each
     * rewrite moves the outer continuation one level inward, so left-nested chains are unwound on the
     * heap rather than the stack. No continuation is ever invoked inside this method.
     */
    @SuppressWarnings("unchecked")
    static <T> Resumption<T> resume(Node<T> node) {
        Node<T> current = node;
        while (true) {
            if (current instanceof Node.Done<T> done) {
                return new Resumption.Finished<>(done.value());
            }
            if (current instanceof Node.Suspend<T> suspend) {
                Supplier<Trampoline<T>> thunk = suspend.thunk();
                return new Resumption.More<>(() -> nodeOf(thunk.get(), "suspended thunk"));
            }
            if (!(current instanceof Node.Bind<?, T>)) {
                throw invariantViolation("node", current);
            }

            Node.Bind<Object, T> bind = (Node.Bind<Object, T>) current;
            Node<Object> sub = bind.sub();
            Function<? super Object, Node<T>> k = bind.k();

            if (sub instanceof Node.Done<Object> done) {
                Object value = done.value();
                return new Resumption.More<>(() -> k.apply(value));
            }
            if (sub instanceof Node.Suspend<Object> suspend) {
                Supplier<Trampoline<Object>> thunk = suspend.thunk();
                return new Resumption.More<>(() -> new Node.Bind<>(nodeOf(thunk.get(), "suspended thunk"), k));
            }
            if (!(sub instanceof Node.Bind<?, Object>)) {
                throw invariantViolation("node", sub);
            }

            Node.Bind<Object, Object> inner = (Node.Bind<Object, Object>) sub;
            Function<? super Object, Node<Object>> innerK = inner.k();
            current = new Node.Bind<Object, T>(inner.sub(), x -> new Node.Bind<>(innerK.apply(x), k));
        }
    }

    private static <T> Node<T> nodeOf(Trampoline<T> trampoline, String producer) {
        if (trampoline == null) {
            throw new NullPointerException(producer + " returned null instead of a Trampoline");
        }
        return trampoline.node;
    }

    private static TrampolineInvariantError invariantViolation(String kind, Object found) {
        String variant = found == null ? "null" : found.getClass().getName();
        TrampolineInvariantError error = new TrampolineInvariantError("Unknown trampoline " + kind + " variant: " + variant);
        logger.error(error.getMessage());
        return error;
    }
}
