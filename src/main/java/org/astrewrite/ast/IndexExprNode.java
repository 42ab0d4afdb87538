package org.astrewrite.ast;

/**
 * An expression followed by an index.
 */
public class IndexExprNode extends AbstractNode implements Expression {

    private Expression x;
    private Expression index;

    public IndexExprNode(Expression x, Expression index) {
        this.x = x;
        this.index = index;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INDEX_EXPR;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }

    public Expression getIndex() {
        return index;
    }

    public void setIndex(Expression index) {
        this.index = index;
    }
}
