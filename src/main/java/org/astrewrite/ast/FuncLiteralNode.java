package org.astrewrite.ast;

/**
 * A function literal.
 */
public class FuncLiteralNode extends AbstractNode implements Expression {

    private FuncTypeNode type;
    private BlockStmtNode body;

    public FuncLiteralNode(FuncTypeNode type, BlockStmtNode body) {
        this.type = type;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_LIT;
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
