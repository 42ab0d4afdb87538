package org.astrewrite.ast;

/**
 * An expression followed by slice indices, e.g. {@code x[low:high:max]}. All indices are optional.
 */
public class SliceExprNode extends AbstractNode implements Expression {

    private final boolean slice3;
    private Expression x;
    private Expression low;
    private Expression high;
    private Expression max;

    public SliceExprNode(Expression x, Expression low, Expression high) {
        this(false, x, low, high, null);
    }

    public SliceExprNode(boolean slice3, Expression x, Expression low, Expression high, Expression max) {
        this.slice3 = slice3;
        this.x = x;
        this.low = low;
        this.high = high;
        this.max = max;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SLICE_EXPR;
    }

    public boolean isSlice3() {
        return slice3;
    }

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }

    public Expression getLow() {
        return low;
    }

    public void setLow(Expression low) {
        this.low = low;
    }

    public Expression getHigh() {
        return high;
    }

    public void setHigh(Expression high) {
        this.high = high;
    }

    public Expression getMax() {
        return max;
    }

    public void setMax(Expression max) {
        this.max = max;
    }

    @Override
    public String describe() {
        return "SliceExpr(slice3=" + slice3 + ")";
    }
}
