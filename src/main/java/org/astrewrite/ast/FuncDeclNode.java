package org.astrewrite.ast;

/**
 * A function declaration. The receiver is absent for functions, the body is absent for external (non-Go) functions.
 */
public class FuncDeclNode extends AbstractNode implements Declaration {

    private CommentGroupNode doc;
    private FieldListNode recv;
    private IdentifierNode name;
    private FuncTypeNode type;
    private BlockStmtNode body;

    public FuncDeclNode(CommentGroupNode doc, FieldListNode recv, IdentifierNode name, FuncTypeNode type, BlockStmtNode body) {
        this.doc = doc;
        this.recv = recv;
        this.name = name;
        this.type = type;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_DECL;
    }

    public CommentGroupNode getDoc() {
        return doc;
    }

    public void setDoc(CommentGroupNode doc) {
        this.doc = doc;
    }

    public FieldListNode getRecv() {
        return recv;
    }

    public void setRecv(FieldListNode recv) {
        this.recv = recv;
    }

    public IdentifierNode getName() {
        return name;
    }

    public void setName(IdentifierNode name) {
        this.name = name;
    }

    public FuncTypeNode getType() {
        return type;
    }

    public void setType(FuncTypeNode type) {
        this.type = type;
    }

    public BlockStmtNode getBody() {
        return body;
    }

    public void setBody(BlockStmtNode body) {
        this.body = body;
    }
}
