package org.astrewrite.ast;

/**
 * An empty statement.
 */
public class EmptyStmtNode extends AbstractNode implements Statement {

    private final boolean implicit;

    public EmptyStmtNode() {
        this(false);
    }

    /**
     * @param implicit {@code true} if the statement stands for an omitted semicolon rather than a written one.
     */
    public EmptyStmtNode(boolean implicit) {
        this.implicit = implicit;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EMPTY_STMT;
    }

    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public String describe() {
        return "EmptyStmt(implicit=" + implicit + ")";
    }
}
