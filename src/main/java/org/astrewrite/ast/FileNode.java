package org.astrewrite.ast;

import java.util.List;

/**
 * A source file.
 */
public class FileNode extends AbstractNode {

    private CommentGroupNode doc;
    private IdentifierNode name;
    private List<Declaration> decls;
    private List<CommentGroupNode> comments;

    public FileNode(CommentGroupNode doc, IdentifierNode name, List<Declaration> decls, List<CommentGroupNode> comments) {
        this.doc = doc;
        this.name = name;
        this.decls = NodeLists.copyOf(decls);
        this.comments = NodeLists.copyOf(comments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILE;
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

    public List<Declaration> getDecls() {
        return decls;
    }

    public void setDecls(List<Declaration> decls) {
        this.decls = NodeLists.copyOf(decls);
    }

    /**
     * Returns the comment index of this file: every comment group of the file in source order,
     * including the groups that are also attached to declarations, specifications and fields.
     * The index is not part of the structural tree and is never visited by a rewrite.
     *
     * @return The mutable list of comment groups.
     */
    public List<CommentGroupNode> getComments() {
        return comments;
    }

    public void setComments(List<CommentGroupNode> comments) {
        this.comments = NodeLists.copyOf(comments);
    }
}
