package org.astrewrite.inspect;

import org.astrewrite.ast.AstNode;
import org.astrewrite.ast.CommentGroupNode;
import org.astrewrite.ast.CommentNode;
import org.astrewrite.ast.FileNode;
import org.astrewrite.dispatch.Multiplicity;
import org.astrewrite.dispatch.Slot;
import org.astrewrite.dispatch.SlotTable;

import java.util.List;

/**
 * Renders a tree as indented text, one node per line.
 * <p>
 * The output is deterministic and contains every kind, attribute, slot name and collection
 * order, so two trees are structurally equal exactly when their dumps are equal. Empty optional
 * slots are omitted; empty collections are printed as {@code []}.
 *
 * <pre>
 * GenDecl(keyword=VAR)
 *   specs[0]: ValueSpec
 *     names[0]: Ident(name=x)
 *     values: []
 * </pre>
 */
public final class AstDumper {

    private static final String INDENT = "  ";

    private AstDumper() {}

    /**
     * @param root The root of the tree, may be {@code null}.
     * @return The text rendering of the tree.
     */
    public static String dump(AstNode root) {
        StringBuilder sb = new StringBuilder();
        if (root == null) {
            return sb.append("<absent>\n").toString();
        }
        sb.append(root.describe()).append('\n');
        dumpChildren(root, 1, sb);
        return sb.toString();
    }

    private static void dumpChildren(AstNode node, int depth, StringBuilder sb) {
        for (Slot<?, ?> slot : SlotTable.slotsOf(node)) {
            List<AstNode> children = slot.children(node);
            if (slot.multiplicity() != Multiplicity.COLLECTION) {
                if (!children.isEmpty()) {
                    dumpNode(slot.name(), children.get(0), depth, sb);
                }
                continue;
            }
            if (children.isEmpty()) {
                indent(depth, sb).append(slot.name()).append(": []\n");
            }
            for (int i = 0; i < children.size(); i++) {
                dumpNode(slot.name() + "[" + i + "]", children.get(i), depth, sb);
            }
        }
        if (node instanceof FileNode file) {
            dumpCommentIndex(file, depth, sb);
        }
    }

    private static void dumpNode(String label, AstNode child, int depth, StringBuilder sb) {
        indent(depth, sb).append(label).append(": ").append(child.describe()).append('\n');
        dumpChildren(child, depth + 1, sb);
    }

    private static void dumpCommentIndex(FileNode file, int depth, StringBuilder sb) {
        List<CommentGroupNode> groups = file.getComments();
        indent(depth, sb).append("comment index: ").append(groups.size()).append(" group(s)\n");
        for (CommentGroupNode group : groups) {
            indent(depth + 1, sb).append('[');
            for (int i = 0; i < group.getComments().size(); i++) {
                CommentNode comment = group.getComments().get(i);
                sb.append(i > 0 ? " | " : "").append(comment.getText());
            }
            sb.append("]\n");
        }
    }

    private static StringBuilder indent(int depth, StringBuilder sb) {
        return sb.append(INDENT.repeat(depth));
    }
}
