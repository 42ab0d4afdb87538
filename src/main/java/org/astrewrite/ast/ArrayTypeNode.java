package org.astrewrite.ast;

/**
 * An array or slice type. The length is absent for slice types.
 */
public class ArrayTypeNode extends AbstractNode implements TypeExpression {

    private Expression len;
    private Expression elt;

    public ArrayTypeNode(Expression len, Expression elt) {
        this.len = len;
        this.elt = elt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ARRAY_TYPE;
    }

    public Expression getLen() {
        return len;
    }

    public void setLen(Expression len) {
        this.len = len;
    }

    public Expression getElt() {
        return elt;
    }

    public void setElt(Expression elt) {
        this.elt = elt;
    }
}
