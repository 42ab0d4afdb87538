package org.astrewrite.ast;

/**
 * A {@code for} statement with a {@code range} clause.
 */
public class RangeStmtNode extends AbstractNode implements Statement {

    private final String operator;
    private Expression key;
    private Expression value;
    private Expression x;
    private BlockStmtNode body;

    public RangeStmtNode(String operator, Expression key, Expression value, Expression x, BlockStmtNode body) {
        this.operator = operator;
        this.key = key;
        this.value = value;
        this.x = x;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RANGE_STMT;
    }

    public String getOperator() {
        return operator;
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

    public Expression getX() {
        return x;
    }

    public void setX(Expression x) {
        this.x = x;
    }

    public BlockStmtNode getBody() {
        return body;
    }

    public void setBody(BlockStmtNode body) {
        this.body = body;
    }

    @Override
    public String describe() {
        return "RangeStmt(operator=" + operator + ")";
    }
}
