package org.astrewrite.ast;

/**
 * A key/value pair in a composite literal.
 */
public class KeyValueExprNode extends AbstractNode implements Expression {

    private Expression key;
    private Expression value;

    public KeyValueExprNode(Expression key, Expression value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.KEY_VALUE_EXPR;
    }

    public Expression getKey() {
        return key;
    }

    public void setKey(Expression key) {
        this.key = key;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }
}
