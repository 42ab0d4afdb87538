package org.astrewrite.ast;

/**
 * A map type.
 */
public class MapTypeNode extends AbstractNode implements TypeExpression {

    private Expression key;
    private Expression value;

    public MapTypeNode(Expression key, Expression value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MAP_TYPE;
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
