package io.github.eutro.wasmopt.print;

import io.github.eutro.wasmopt.ast.Expression;
import io.github.eutro.wasmopt.ext.CommonExts;

/**
 * Thrown when a well-formed tree uses something that cannot be printed (yet).
 * <p>
 * Unlike a malformed tree, this does not indicate a bug in whatever produced the tree,
 * so callers may choose to carry on without the offending part, see {@link UnsupportedFeaturePolicy}.
 */
public class UnsupportedFeatureException extends UnsupportedOperationException {
    private final transient Expression node;
    private final String feature;

    public UnsupportedFeatureException(Expression node, String feature) {
        super(feature + " is not supported, in " + node);
        this.node = node;
        this.feature = feature;
        Throwable allocatedAt = node.getNullable(CommonExts.ALLOCATED_AT);
        if (allocatedAt != null) addSuppressed(allocatedAt);
    }

    /**
     * Get the node that uses the feature.
     *
     * @return The node.
     */
    public Expression getNode() {
        return node;
    }

    /**
     * Get the arena handle of the node that uses the feature.
     *
     * @return The handle, or -1 if the node was not allocated from an arena.
     */
    public int getHandle() {
        return node.getHandle();
    }

    public String getFeature() {
        return feature;
    }
}
