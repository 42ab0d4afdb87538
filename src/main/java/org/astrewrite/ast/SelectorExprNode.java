package org.astrewrite.ast;

/**
 * An expression followed by a selector, e.g. {@code x.sel}.
 */
public class SelectorExprNode extends AbstractNode implements Expression {

    private Expression x;
    private IdentifierNode sel;

    public SelectorExprNode(Expression x, IdentifierNode sel) {
        this.x = x;
        this.sel = sel;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SELECTOR_EXPR;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }

    public IdentifierNode getSel() {
        return sel;
    }

    public void setSel(IdentifierNode sel) {
        this.sel = sel;
    }
}
