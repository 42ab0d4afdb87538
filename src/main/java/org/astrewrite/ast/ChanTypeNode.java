package org.astrewrite.ast;

/**
 * A channel type.
 */
public class ChanTypeNode extends AbstractNode implements TypeExpression {

    private final ChanDir dir;
    private Expression value;

    public ChanTypeNode(ChanDir dir, Expression value) {
        this.dir = dir;
        this.value = value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CHAN_TYPE;
    }

    public ChanDir getDir() {
        return dir;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }

    @Override
    public String describe() {
        return "ChanType(dir=" + dir + ")";
    }
}
