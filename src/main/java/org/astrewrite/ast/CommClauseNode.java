package org.astrewrite.ast;

import java.util.List;

/**
 * A case of a select statement. An absent communication denotes the default case.
 */
public class CommClauseNode extends AbstractNode implements Statement {

    private Statement comm;
    private List<Statement> body;

    public CommClauseNode(Statement comm, List<Statement> body) {
        this.comm = comm;
        this.body = NodeLists.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMM_CLAUSE;
    }

    public Statement getComm() {
        return comm;
    }

    public void setComm(Statement comm) {
        this.comm = comm;
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = NodeLists.copyOf(body);
    }
}
