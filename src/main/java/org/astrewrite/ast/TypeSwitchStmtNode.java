package org.astrewrite.ast;

/**
 * A type switch statement.
 */
public class TypeSwitchStmtNode extends AbstractNode implements Statement {

    private Statement init;
    private Statement assign;
    private BlockStmtNode body;

    public TypeSwitchStmtNode(Statement init, Statement assign, BlockStmtNode body) {
        this.init = init;
        this.assign = assign;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_SWITCH_STMT;
    }

    public Statement getInit() {
        return init;
    }

    public void setInit(Statement init) {
        this.init = init;
    }

    public Statement getAssign() {
        return assign;
    }

    public void setAssign(Statement assign) {
        this.assign = assign;
    }

    public BlockStmtNode getBody() {
        return body;
    }

    public void setBody(BlockStmtNode body) {
        this.body = body;
    }
}
