package org.astrewrite.ast;

/**
 * A single comment, either a line comment or a block comment. Comments are terminal nodes.
 */
public class CommentNode extends AbstractNode {

    private final String text;

    public CommentNode(String text) {
        this.text = text;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMMENT;
    }

    public String getText() {
        return text;
    }

    @Override
    public String describe() {
        return "Comment(text=" + text + ")";
    }
}
