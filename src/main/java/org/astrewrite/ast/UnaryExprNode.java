package org.astrewrite.ast;

/**
 * A unary expression. Pointer dereferences are represented by {@link StarExprNode}.
 */
public class UnaryExprNode extends AbstractNode implements Expression {

    private final String operator;
    private Expression x;

    public UnaryExprNode(String operator, Expression x) {
        this.operator = operator;
        this.x = x;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.UNARY_EXPR;
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

    @Override
    public String describe() {
        return "UnaryExpr(operator=" + operator + ")";
    }
}
