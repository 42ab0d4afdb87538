package org.astrewrite.ast;

/**
 * A binary expression.
 */
public class BinaryExprNode extends AbstractNode implements Expression {

    private final String operator;
    private Expression x;
    private Expression y;

    public BinaryExprNode(String operator, Expression x, Expression y) {
        this.operator = operator;
        this.x = x;
        this.y = y;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BINARY_EXPR;
    }

    public String getOperator() {
        return operator;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }

    public Expression getY() {
        return y;
    }

    public void setY(Expression y) {
        this.y = y;
    }

    @Override
    public String describe() {
        return "BinaryExpr(operator=" + operator + ")";
    }
}
