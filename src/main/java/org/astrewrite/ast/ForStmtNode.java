package org.astrewrite.ast;

/**
 * A {@code for} statement.
 */
public class ForStmtNode extends AbstractNode implements Statement {

    private Statement init;
    private Expression cond;
    private Statement post;
    private BlockStmtNode body;

    public ForStmtNode(Statement init, Expression cond, Statement post, BlockStmtNode body) {
        this.init = init;
        this.cond = cond;
        this.post = post;
        this.body = body;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR_STMT;
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

    public Statement getPost() {
        return post;
    }

    public void setPost(Statement post) {
        this.post = post;
    }

    public BlockStmtNode getBody() {
        return body;
    }

    public void setBody(BlockStmtNode body) {
        this.body = body;
    }
}
