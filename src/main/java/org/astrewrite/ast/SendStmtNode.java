package org.astrewrite.ast;

/**
 * A send statement.
 */
public class SendStmtNode extends AbstractNode implements Statement {

    private Expression chan;
    private Expression value;

    public SendStmtNode(Expression chan, Expression value) {
        this.chan = chan;
        this.value = value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SEND_STMT;
    }

    public Expression getChan() {
        return chan;
    }

    public void setChan(Expression chan) {
        this.chan = chan;
    }

    public Expression getValue() {
        return value;
    }

    public void setValue(Expression value) {
        this.value = value;
    }
}
