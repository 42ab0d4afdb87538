package org.astrewrite.ast;

/**
 * A {@code break}, {@code continue}, {@code goto} or {@code fallthrough} statement.
 */
public class BranchStmtNode extends AbstractNode implements Statement {

    private final String keyword;
    private IdentifierNode label;

    public BranchStmtNode(String keyword, IdentifierNode label) {
        this.keyword = keyword;
        this.label = label;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BRANCH_STMT;
    }

    public String getKeyword() {
        return keyword;
    }

    public IdentifierNode getLabel() {
        return label;
    }

    public void setLabel(IdentifierNode label) {
        this.label = label;
    }

    @Override
    public String describe() {
        return "BranchStmt(keyword=" + keyword + ")";
    }
}
