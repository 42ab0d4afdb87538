package org.astrewrite.ast;

/**
 * A struct type.
 */
public class StructTypeNode extends AbstractNode implements TypeExpression {

    private FieldListNode fields;

    public StructTypeNode(FieldListNode fields) {
        this.fields = fields;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRUCT_TYPE;
    }

    public FieldListNode getFields() {
        return fields;
    }

    public void setFields(FieldListNode fields) {
        this.fields = fields;
    }
}
