package org.astrewrite.ast;

/**
 * A placeholder for a declaration containing syntax errors for which no correct node can be created.
 */
public class BadDeclNode extends AbstractNode implements Declaration {

    public BadDeclNode() {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BAD_DECL;
    }
}
