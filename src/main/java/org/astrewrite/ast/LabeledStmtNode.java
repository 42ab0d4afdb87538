package org.astrewrite.ast;

/**
 * A labeled statement.
 */
public class LabeledStmtNode extends AbstractNode implements Statement {

    private IdentifierNode label;
    private Statement stmt;

    public LabeledStmtNode(IdentifierNode label, Statement stmt) {
        this.label = label;
        this.stmt = stmt;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LABELED_STMT;
    }

    public IdentifierNode getLabel() {
        return label;
    }

    public void setLabel(IdentifierNode label) {
        this.label = label;
    }

    public Statement getStmt() {
        return stmt;
    }

    public void setStmt(Statement stmt) {
        this.stmt = stmt;
    }
}
