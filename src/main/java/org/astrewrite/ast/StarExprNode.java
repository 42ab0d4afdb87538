package org.astrewrite.ast;

/**
 * An expression of the form {@code *x}: a pointer type or a dereference.
 */
public class StarExprNode extends AbstractNode implements Expression {

    private Expression x;

    public StarExprNode(Expression x) {
        this.x = x;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STAR_EXPR;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }
}
