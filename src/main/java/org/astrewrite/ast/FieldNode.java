package org.astrewrite.ast;

import java.util.List;

/**
 * A field declaration in a struct type, a method in an interface type, or a parameter/result
 * declaration in a function signature.
 */
public class FieldNode extends AbstractNode {

    private CommentGroupNode doc;
    private List<IdentifierNode> names;
    private Expression type;
    private BasicLiteralNode tag;
    private CommentGroupNode comment;

    public FieldNode(CommentGroupNode doc, List<IdentifierNode> names, Expression type, BasicLiteralNode tag, CommentGroupNode comment) {
        this.doc = doc;
        this.names = NodeLists.copyOf(names);
        this.type = type;
        this.tag = tag;
        this.comment = comment;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FIELD;
    }

    public CommentGroupNode getDoc() {
        return doc;
    }

    public void setDoc(CommentGroupNode doc) {
        this.doc = doc;
    }

    public List<IdentifierNode> getNames() {
        return names;
    }

    public void setNames(List<IdentifierNode> names) {
        this.names = NodeLists.copyOf(names);
    }

    public Expression getType() {
        return type;
    }

    public void setType(Expression type) {
        this.type = type;
    }

    /**
     * @return The struct tag literal, or {@code null} if the field has none.
     */
    public BasicLiteralNode getTag() {
        return tag;
    }

    public void setTag(BasicLiteralNode tag) {
        this.tag = tag;
    }

    public CommentGroupNode getComment() {
        return comment;
    }

    public void setComment(CommentGroupNode comment) {
        this.comment = comment;
    }
}
