package org.astrewrite.ast;

/**
 * A (stand-alone) expression in a statement list.
 */
public class ExprStmtNode extends AbstractNode implements Statement {

    private Expression x;

    public ExprStmtNode(Expression x) {
        this.x = x;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPR_STMT;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }
}
