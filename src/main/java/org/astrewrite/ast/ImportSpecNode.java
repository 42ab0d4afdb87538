package org.astrewrite.ast;

/**
 * A single package import.
 */
public class ImportSpecNode extends AbstractNode implements Specification {

    private CommentGroupNode doc;
    private IdentifierNode name;
    private BasicLiteralNode path;
    private CommentGroupNode comment;

    public ImportSpecNode(CommentGroupNode doc, IdentifierNode name, BasicLiteralNode path, CommentGroupNode comment) {
        this.doc = doc;
        this.name = name;
        this.path = path;
        this.comment = comment;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IMPORT_SPEC;
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

    public BasicLiteralNode getPath() {
        return path;
    }

    public void setPath(BasicLiteralNode path) {
        this.path = path;
    }

    public CommentGroupNode getComment() {
        return comment;
    }

    public void setComment(CommentGroupNode comment) {
        this.comment = comment;
    }
}
