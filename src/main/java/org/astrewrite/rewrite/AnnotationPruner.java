package org.astrewrite.rewrite;

import org.astrewrite.ast.AstNode;
import org.astrewrite.ast.CommentGroupNode;
import org.astrewrite.ast.FileNode;
import org.astrewrite.ast.PackageNode;
import org.astrewrite.inspect.AstInspector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detaches the comments of subtrees that a rewrite discards.
 * <p>
 * Comment groups may be shared between the node they are attached to and the comment index of
 * the enclosing file. Emptying every group reachable from a discarded subtree guarantees that no
 * retained location keeps a comment whose owner is gone. The pruner never calls the rewrite
 * visitor and never descends into a comment group.
 */
final class AnnotationPruner {

    private static final Logger LOG = LoggerFactory.getLogger(AnnotationPruner.class);

    private final StatisticsCollector statistics;

    AnnotationPruner(StatisticsCollector statistics) {
        this.statistics = statistics;
    }

    /**
     * Empties every comment group attached within {@code discarded}. For a discarded file the
     * groups of its comment index are emptied too.
     *
     * @param discarded The root of the subtree being dropped.
     */
    void prune(AstNode discarded) {
        AstInspector.inspect(discarded, node -> {
            if (node instanceof CommentGroupNode group) {
                clear(group);
                return false;
            }
            if (node instanceof FileNode file) {
                file.getComments().forEach(this::clear);
            }
            return true;
        });
    }

    /**
     * Removes the comment groups left empty by pruning from the comment index of every file
     * in {@code root}.
     *
     * @param root The root of a retained tree.
     */
    void compactCommentIndexes(AstNode root) {
        AstInspector.inspect(root, node -> {
            if (node instanceof FileNode file) {
                int before = file.getComments().size();
                file.getComments().removeIf(group -> group.getComments().isEmpty());
                if (file.getComments().size() != before) {
                    LOG.trace("Dropped {} empty comment group(s) from the index of {}",
                            before - file.getComments().size(), file.getName() != null ? file.getName().getName() : "file");
                }
                return false;
            }
            // Files only occur as the root or inside a package.
            return node instanceof PackageNode;
        });
    }

    private void clear(CommentGroupNode group) {
        int count = group.getComments().size();
        if (count == 0) {
            return;
        }
        group.getComments().clear();
        statistics.commentsPruned(count);
        LOG.trace("Pruned {} comment(s) of a discarded subtree", count);
    }
}
