package io.github.jbellis.docindex;

/**
 * Thrown when the offset index cannot reach a node from its traversal cursor. This means the
 * node does not belong to the indexed tree, or the tree changed after indexing started. It
 * signals a caller bug and is never used for ordinary misses.
 */
public class OffsetTraversalException extends IllegalStateException {
    public OffsetTraversalException(String message) {
        super(message);
    }
}
