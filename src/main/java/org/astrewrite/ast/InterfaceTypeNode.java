package org.astrewrite.ast;

/**
 * An interface type.
 */
public class InterfaceTypeNode extends AbstractNode implements TypeExpression {

    private FieldListNode methods;

    public InterfaceTypeNode(FieldListNode methods) {
        this.methods = methods;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.INTERFACE_TYPE;
    }

    public FieldListNode getMethods() {
        return methods;
    }

    public void setMethods(FieldListNode methods) {
        this.methods = methods;
    }
}
