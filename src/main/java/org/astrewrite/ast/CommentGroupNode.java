package org.astrewrite.ast;

import java.util.List;

/**
 * A sequence of comments with no other tokens and no empty lines between them.
 * <p>
 * Comment groups are attached to declarations, specifications and fields as leading
 * documentation or trailing comments. The file that owns them additionally keeps every
 * group in its comment index, see {@link FileNode#getComments()}.
 */
public class CommentGroupNode extends AbstractNode {

    private List<CommentNode> comments;

    public CommentGroupNode(List<CommentNode> comments) {
        this.comments = NodeLists.copyOf(comments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMMENT_GROUP;
    }

    /**
     * @return The comments of this group, in source order.
     */
    public List<CommentNode> getComments() {
        return comments;
    }

    public void setComments(List<CommentNode> comments) {
        this.comments = NodeLists.copyOf(comments);
    }
}
