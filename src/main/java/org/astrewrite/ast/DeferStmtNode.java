package org.astrewrite.ast;

/**
 * A {@code defer} statement.
 */
public class DeferStmtNode extends AbstractNode implements Statement {

    private CallExprNode call;

    public DeferStmtNode(CallExprNode call) {
        this.call = call;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DEFER_STMT;
    }

    public CallExprNode getCall() {
        return call;
    }

    public void setCall(CallExprNode call) {
        this.call = call;
    }
}
