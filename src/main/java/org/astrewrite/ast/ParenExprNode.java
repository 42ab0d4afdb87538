package org.astrewrite.ast;

/**
 * A parenthesized expression.
 */
public class ParenExprNode extends AbstractNode implements Expression {

    private Expression x;

    public ParenExprNode(Expression x) {
        this.x = x;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PAREN_EXPR;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }
}
