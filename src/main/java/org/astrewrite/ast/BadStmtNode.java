package org.astrewrite.ast;

/**
 * A placeholder for statements containing syntax errors for which no correct node can be created.
 */
public class BadStmtNode extends AbstractNode implements Statement {

    public BadStmtNode() {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BAD_STMT;
    }
}
