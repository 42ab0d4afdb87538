package org.astrewrite.ast;

import java.util.List;

/**
 * A case of an expression or type switch statement. An empty expression list denotes the default case.
 */
public class CaseClauseNode extends AbstractNode implements Statement {

    private List<Expression> list;
    private List<Statement> body;

    public CaseClauseNode(List<Expression> list, List<Statement> body) {
        this.list = NodeLists.copyOf(list);
        this.body = NodeLists.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CASE_CLAUSE;
    }

    public List<Expression> getList() {
        return list;
    }

    public void setList(List<Expression> list) {
        this.list = NodeLists.copyOf(list);
    }

    public List<Statement> getBody() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = NodeLists.copyOf(body);
    }
}
