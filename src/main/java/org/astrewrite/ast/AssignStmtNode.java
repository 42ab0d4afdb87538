package org.astrewrite.ast;

import java.util.List;

/**
 * An assignment or a short variable declaration.
 */
public class AssignStmtNode extends AbstractNode implements Statement {

    private final String operator;
    private List<Expression> lhs;
    private List<Expression> rhs;

    public AssignStmtNode(String operator, List<Expression> lhs, List<Expression> rhs) {
        this.operator = operator;
        this.lhs = NodeLists.copyOf(lhs);
        this.rhs = NodeLists.copyOf(rhs);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ASSIGN_STMT;
    }

    public String getOperator() {
        return operator;
    }

    public List<Expression> getLhs() {
        return lhs;
    }

    public void setLhs(List<Expression> lhs) {
        this.lhs = NodeLists.copyOf(lhs);
    }

    public List<Expression> getRhs() {
        return rhs;
    }

    public void setRhs(List<Expression> rhs) {
        this.rhs = NodeLists.copyOf(rhs);
    }

    @Override
    public String describe() {
        return "AssignStmt(operator=" + operator + ")";
    }
}
