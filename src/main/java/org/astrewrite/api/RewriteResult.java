package org.astrewrite.api;

import org.astrewrite.ast.AstNode;

/**
 * The outcome of a completed rewrite.
 *
 * @param root The rewritten root, or {@code null} if the root was removed or no root was given.
 * @param removed {@code true} if the root itself was removed, explicitly or by cascade.
 * @param statistics Counters collected during the walk.
 */
public record RewriteResult(
        AstNode root,
        boolean removed,
        RewriteStatistics statistics
) {
}
