package io.github.eutro.wasmopt.print;

/**
 * What to do with a function of a module that uses an {@link UnsupportedFeatureException unsupported feature}.
 */
public enum UnsupportedFeaturePolicy {
    /**
     * Rethrow, abandoning the whole module.
     */
    ABORT,
    /**
     * Leave the function out of the output.
     */
    SKIP,
    /**
     * Log a warning, and leave the function out of the output.
     */
    WARN,
}
