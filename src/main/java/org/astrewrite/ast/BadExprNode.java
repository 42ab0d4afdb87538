package org.astrewrite.ast;

/**
 * A placeholder for an expression containing syntax errors for which no correct node can be created.
 */
public class BadExprNode extends AbstractNode implements Expression {

    public BadExprNode() {
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BAD_EXPR;
    }
}
