package org.astrewrite.ast;

/**
 * An identifier.
 */
public class IdentifierNode extends AbstractNode implements Expression {

    private String name;

    public IdentifierNode(String name) {
        this.name = name;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IDENT;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    @Override
    public String describe() {
        return "Ident(name=" + name + ")";
    }
}
