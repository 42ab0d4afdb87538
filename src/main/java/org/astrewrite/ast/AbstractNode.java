package org.astrewrite.ast;

/**
 * Common base class of the built-in node kinds.
 */
public abstract class AbstractNode implements AstNode {

    @Override
    public String toString() {
        return describe();
    }
}
