package org.astrewrite.rewrite;

import org.astrewrite.ast.AstNode;

/**
 * A visitor driving a rewrite.
 * <p>
 * {@link #enter(AstNode)} is called pre-order for every node reached by the walk and decides
 * what happens to it. {@link #leave(AstNode)} is called post-order once all children of a node
 * have been processed; it carries no decision and exists so that visitors can maintain
 * per-subtree state such as a scope stack.
 * <p>
 * A visitor instance may keep arbitrary state, it is only ever called from the thread running the walk.
 */
@FunctionalInterface
public interface RewriteVisitor {

    /**
     * Decides the fate of {@code node}.
     *
     * @param node The node about to be visited, never {@code null}.
     * @return The decision, never {@code null}.
     */
    VisitResult enter(AstNode node);

    /**
     * Signals that the walk finished descending into {@code node}.
     * <p>
     * Not called for nodes that were removed, for nodes whose descent was skipped, or for nodes
     * that were removed by a cascade while their children were processed.
     *
     * @param node The retained node (the replacement, if the visitor replaced it).
     */
    default void leave(AstNode node) {
    }
}
