package org.astrewrite.ast;

/**
 * A {@code go} statement.
 */
public class GoStmtNode extends AbstractNode implements Statement {

    private CallExprNode call;

    public GoStmtNode(CallExprNode call) {
        this.call = call;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.GO_STMT;
    }

    public CallExprNode getCall() {
        return call;
    }

    public void setCall(CallExprNode call) {
        this.call = call;
    }
}
