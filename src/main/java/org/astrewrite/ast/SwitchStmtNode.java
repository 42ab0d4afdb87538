package org.astrewrite.ast;

/**
 * An expression switch statement.
 */
public class SwitchStmtNode extends AbstractNode implements Statement {

    private Statement init;
    private Expression tag;
    private BlockStmtNode body;

    public SwitchStmtNode(Statement init, Expression tag, BlockStmtNode body) {
        this.init = init;
        this.tag = tag;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SWITCH_STMT;
    }

    public Statement getInit() {
        return init;
    }

    public void setInit(Statement init) {
        this.init = init;
    }

    public Expression getTag() {
        return tag;
    }

    public void setTag(Expression tag) {
        this.tag = tag;
    }

    public BlockStmtNode getBody() {
        return body;
    }

    public void setBody(BlockStmtNode body) {
        this.body = body;
    }
}
