package org.astrewrite.ast;

import java.util.List;

/**
 * A constant or variable declaration entry.
 */
public class ValueSpecNode extends AbstractNode implements Specification {

    private CommentGroupNode doc;
    private List<IdentifierNode> names;
    private Expression type;
    private List<Expression> values;
    private CommentGroupNode comment;

    public ValueSpecNode(CommentGroupNode doc, List<IdentifierNode> names, Expression type, List<Expression> values, CommentGroupNode comment) {
        this.doc = doc;
        this.names = NodeLists.copyOf(names);
        this.type = type;
        this.values = NodeLists.copyOf(values);
        this.comment = comment;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VALUE_SPEC;
    }

    public CommentGroupNode getDoc() {
        return doc;
    }

    public void setDoc(CommentGroupNode doc) {
        this.doc = doc;
    }

    public List<IdentifierNode> getNames() {
        return names;
    }

    public void setNames(List<IdentifierNode> names) {
        this.names = NodeLists.copyOf(names);
    }

    public Expression getType() {
        return type;
    }

    public void setType(Expression type) {
        this.type = type;
    }

    public List<Expression> getValues() {
        return values;
    }

    public void setValues(List<Expression> values) {
        this.values = NodeLists.copyOf(values);
    }

    public CommentGroupNode getComment() {
        return comment;
    }

    public void setComment(CommentGroupNode comment) {
        this.comment = comment;
    }
}
