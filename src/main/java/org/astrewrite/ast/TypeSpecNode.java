package org.astrewrite.ast;

/**
 * A type declaration entry.
 */
public class TypeSpecNode extends AbstractNode implements Specification {

    private final boolean alias;
    private CommentGroupNode doc;
    private IdentifierNode name;
    private Expression type;
    private CommentGroupNode comment;

    public TypeSpecNode(CommentGroupNode doc, IdentifierNode name, Expression type, CommentGroupNode comment) {
        this(false, doc, name, type, comment);
    }

    public TypeSpecNode(boolean alias, CommentGroupNode doc, IdentifierNode name, Expression type, CommentGroupNode comment) {
        this.alias = alias;
        this.doc = doc;
        this.name = name;
        this.type = type;
        this.comment = comment;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_SPEC;
    }

    public boolean isAlias() {
        return alias;
    }

    public CommentGroupNode getDoc() {
        return doc;
    }

    public void setDoc(CommentGroupNode doc) {
        this.doc = doc;
    }

    public IdentifierNode getName() {
        return name;
    }

    public void setName(IdentifierNode name) {
        this.name = name;
    }

    public Expression getType() {
        return type;
    }

    public void setType(Expression type) {
        this.type = type;
    }

    public CommentGroupNode getComment() {
        return comment;
    }

    public void setComment(CommentGroupNode comment) {
        this.comment = comment;
    }

    @Override
    public String describe() {
        return "TypeSpec(alias=" + alias + ")";
    }
}
