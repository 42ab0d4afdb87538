package org.astrewrite.ast;

import java.util.List;

/**
 * A braced statement list.
 */
public class BlockStmtNode extends AbstractNode implements Statement {

    private List<Statement> stmts;

    public BlockStmtNode(List<Statement> stmts) {
        this.stmts = NodeLists.copyOf(stmts);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK_STMT;
    }

    public List<Statement> getStmts() {
        return stmts;
    }

    public void setStmts(List<Statement> stmts) {
        this.stmts = NodeLists.copyOf(stmts);
    }
}
