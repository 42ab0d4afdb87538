package org.astrewrite.inspect;

import org.astrewrite.ast.AstNode;
import org.astrewrite.dispatch.SlotTable;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Read-only, pre-order traversal of a tree.
 * <p>
 * Children are discovered through the {@link SlotTable}, so the inspector needs no knowledge of
 * the concrete node classes. Attached comment groups are reached like any other child; the comment
 * index of a file is not.
 */
public final class AstInspector {

    private AstInspector() {}

    /**
     * Visits {@code root} and its descendants in depth-first order.
     *
     * @param root The root of the tree. Nothing happens if it is {@code null}.
     * @param visitor Called for every node; returning {@code false} skips the children of that node.
     */
    public static void inspect(AstNode root, Predicate<AstNode> visitor) {
        if (root == null) {
            return;
        }
        if (!visitor.test(root)) {
            return;
        }
        for (AstNode child : SlotTable.childrenOf(root)) {
            inspect(child, visitor);
        }
    }

    /**
     * Collects every node of the given type, in pre-order.
     *
     * @param root The root of the tree, may be {@code null}.
     * @param type The node type to collect.
     * @param <T> The node type.
     * @return The matching nodes; empty if there are none.
     */
    public static <T extends AstNode> List<T> collect(AstNode root, Class<T> type) {
        List<T> found = new ArrayList<>();
        inspect(root, node -> {
            if (type.isInstance(node)) {
                found.add(type.cast(node));
            }
            return true;
        });
        return found;
    }
}
