package org.astrewrite.ast;

import java.util.List;

/**
 * A {@code return} statement.
 */
public class ReturnStmtNode extends AbstractNode implements Statement {

    private List<Expression> results;

    public ReturnStmtNode(List<Expression> results) {
        this.results = NodeLists.copyOf(results);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN_STMT;
    }

    public List<Expression> getResults() {
        return results;
    }

    public void setResults(List<Expression> results) {
        this.results = NodeLists.copyOf(results);
    }
}
