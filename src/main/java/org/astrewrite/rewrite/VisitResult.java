package org.astrewrite.rewrite;

import org.astrewrite.api.RewriteErrorCode;
import org.astrewrite.api.RewriteException;
import org.astrewrite.ast.AstNode;

/**
 * The decision a {@link RewriteVisitor} takes for a node.
 * <p>
 * Removal is an explicit outcome: there is no way to request it by returning an absent node.
 */
public final class VisitResult {

    private static final VisitResult REMOVE = new VisitResult(null, false, true);

    private final AstNode node;
    private final boolean descend;
    private final boolean removal;

    private VisitResult(AstNode node, boolean descend, boolean removal) {
        this.node = node;
        this.descend = descend;
        this.removal = removal;
    }

    /**
     * Keeps {@code node} (the visited node itself, an edited version of it or a replacement) and
     * continues into its children.
     */
    public static VisitResult descend(AstNode node) {
        return new VisitResult(requireNode(node), true, false);
    }

    /**
     * Keeps {@code node} but does not visit any of its children.
     */
    public static VisitResult skip(AstNode node) {
        return new VisitResult(requireNode(node), false, false);
    }

    /**
     * Removes the visited node. Its children are not visited.
     */
    public static VisitResult remove() {
        return REMOVE;
    }

    public AstNode node() {
        return node;
    }

    public boolean shouldDescend() {
        return descend;
    }

    public boolean isRemoval() {
        return removal;
    }

    private static AstNode requireNode(AstNode node) {
        if (node == null) {
            throw new RewriteException(RewriteErrorCode.INVALID_VISIT_RESULT,
                    "Cannot keep an absent node; use VisitResult.remove() to remove it");
        }
        return node;
    }

    @Override
    public String toString() {
        if (removal) {
            return "VisitResult(remove)";
        }
        return String.format("VisitResult(%s, %s)", descend ? "descend" : "skip", node.describe());
    }
}
