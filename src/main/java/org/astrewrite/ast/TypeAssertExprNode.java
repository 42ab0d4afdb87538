package org.astrewrite.ast;

/**
 * An expression followed by a type assertion. The type is absent for the {@code x.(type)} form of a type switch.
 */
public class TypeAssertExprNode extends AbstractNode implements Expression {

    private Expression x;
    private Expression type;

    public TypeAssertExprNode(Expression x, Expression type) {
        this.x = x;
        this.type = type;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_ASSERT_EXPR;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }

    public Expression getType() {
        return type;
    }

    public void setType(Expression type) {
        this.type = type;
    }
}
