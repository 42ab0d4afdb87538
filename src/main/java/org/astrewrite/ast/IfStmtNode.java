package org.astrewrite.ast;

/**
 * An {@code if} statement.
 */
public class IfStmtNode extends AbstractNode implements Statement {

    private Statement init;
    private Expression cond;
    private BlockStmtNode body;
    private Statement elseBranch;

    public IfStmtNode(Statement init, Expression cond, BlockStmtNode body, Statement elseBranch) {
        this.init = init;
        this.cond = cond;
        this.body = body;
        this.elseBranch = elseBranch;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF_STMT;
    }

    public Statement getInit() {
        return init;
    }

    public void setInit(Statement init) {
        this.init = init;
    }

    public Expression getCond() {
        return cond;
    }

    public void setCond(Expression cond) {
        this.cond = cond;
    }

    public BlockStmtNode getBody() {
        return body;
    }

    public void setBody(BlockStmtNode body) {
        this.body = body;
    }

    public Statement getElseBranch() {
        return elseBranch;
    }

    public void setElseBranch(Statement elseBranch) {
        this.elseBranch = elseBranch;
    }
}
