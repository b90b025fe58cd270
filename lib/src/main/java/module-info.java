/**
 * Basis - Core Module
 *
 * Stack-safe evaluation of deeply chained computations:
 * - Trampolined computations that run in constant stack space
 * - Re-association of left-nested binds while evaluating
 * - sequence / mapM combinators built on bind
 *
 * @since 0.4.0
 */
module com.typelift.basis {
    // Required dependencies
    requires org.slf4j;

    // Computation API
    exports com.typelift.basis.functional;

    // Configuration classes
    exports com.typelift.basis.config;

    // Version identifiers
    exports com.typelift.basis.version;

    // examples is not exported
}
