package org.astrewrite.ast;

/**
 * The {@code ...} of a variadic parameter type or of an array length. The element type is absent
 * when the ellipsis stands for an array length.
 */
public class EllipsisNode extends AbstractNode implements Expression {

    private Expression elt;

    public EllipsisNode(Expression elt) {
        this.elt = elt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ELLIPSIS;
    }

    public Expression getElt() {
        return elt;
    }

    public void setElt(Expression elt) {
        this.elt = elt;
    }
}
