package org.astrewrite.ast;

/**
 * An increment or decrement statement.
 */
public class IncDecStmtNode extends AbstractNode implements Statement {

    private final boolean increment;
    private Expression x;

    public IncDecStmtNode(boolean increment, Expression x) {
        this.increment = increment;
        this.x = x;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INC_DEC_STMT;
    }

    public boolean isIncrement() {
        return increment;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }

    @Override
    public String describe() {
        return "IncDecStmt(increment=" + increment + ")";
    }
}
