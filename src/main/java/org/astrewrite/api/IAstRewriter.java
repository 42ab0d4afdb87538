package org.astrewrite.api;

import org.astrewrite.ast.AstNode;
import org.astrewrite.rewrite.RewriteVisitor;

/**
 * Defines the public interface of the AST rewrite engine.
 * <p>
 * A rewrite is a depth-first traversal in which the visitor may replace a node, remove it or
 * stop the descent below it. Removals propagate upwards through required slots and through
 * collections whose emptiness invalidates their owner. The tree is mutated in place.
 */
public interface IAstRewriter {

    /**
     * Rewrites the tree below {@code root}.
     *
     * @param root The root of the tree to rewrite. May be {@code null}, in which case the visitor is never called.
     * @param visitor The visitor deciding, node by node, what to keep, replace or remove.
     * @return The outcome of the rewrite, including the new root.
     * @throws RewriteException if the visitor or the tree violates the rewrite contract.
     */
    RewriteResult rewrite(AstNode root, RewriteVisitor visitor);

    /**
     * Rewrites the tree below {@code root} and returns the new root.
     *
     * @param root The root of the tree to rewrite. May be {@code null}.
     * @param visitor The visitor deciding, node by node, what to keep, replace or remove.
     * @return The rewritten root, or {@code null} if the root was removed or was {@code null}.
     * @throws RewriteException if the visitor or the tree violates the rewrite contract.
     */
    default AstNode walk(AstNode root, RewriteVisitor visitor) {
        return rewrite(root, visitor).root();
    }
}
