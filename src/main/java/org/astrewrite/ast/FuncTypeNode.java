package org.astrewrite.ast;

/**
 * A function type: the signature of a function literal, function declaration or function type expression.
 */
public class FuncTypeNode extends AbstractNode implements TypeExpression {

    private FieldListNode params;
    private FieldListNode results;

    public FuncTypeNode(FieldListNode params, FieldListNode results) {
        this.params = params;
        this.results = results;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNC_TYPE;
    }

    public FieldListNode getParams() {
        return params;
    }

    public void setParams(FieldListNode params) {
        this.params = params;
    }

    public FieldListNode getResults() {
        return results;
    }

    public void setResults(FieldListNode results) {
        this.results = results;
    }
}
