package org.astrewrite.ast;

/**
 * A {@code select} statement.
 */
public class SelectStmtNode extends AbstractNode implements Statement {

    private BlockStmtNode body;

    public SelectStmtNode(BlockStmtNode body) {
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SELECT_STMT;
    }

    public BlockStmtNode getBody() {
        return body;
    }

    public void setBody(BlockStmtNode body) {
        this.body = body;
    }
}
