package org.astrewrite.rewrite;

import org.astrewrite.ast.AstNode;

/**
 * The outcome of walking one node: either the node to retain, or a removal.
 * A removal carries the subtree that is being discarded so its comments can be pruned.
 *
 * @param node The retained node, {@code null} on removal.
 * @param discarded The discarded subtree root, {@code null} unless removed.
 */
record Rewritten(AstNode node, AstNode discarded) {

    static Rewritten kept(AstNode node) {
        return new Rewritten(node, null);
    }

    static Rewritten removed(AstNode discarded) {
        return new Rewritten(null, discarded);
    }

    boolean isRemoved() {
        return node == null;
    }
}
