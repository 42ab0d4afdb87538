package org.astrewrite.ast;

import java.util.List;

/**
 * A list of fields, enclosed by parentheses or braces.
 */
public class FieldListNode extends AbstractNode {

    private List<FieldNode> fields;

    public FieldListNode(List<FieldNode> fields) {
        this.fields = NodeLists.copyOf(fields);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FIELD_LIST;
    }

    public List<FieldNode> getFields() {
        return fields;
    }

    public void setFields(List<FieldNode> fields) {
        this.fields = NodeLists.copyOf(fields);
    }
}
