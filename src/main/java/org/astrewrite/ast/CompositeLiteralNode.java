package org.astrewrite.ast;

import java.util.List;

/**
 * A composite literal. The type may be absent when it is implied by the context.
 */
public class CompositeLiteralNode extends AbstractNode implements Expression {

    private Expression type;
    private List<Expression> elts;

    public CompositeLiteralNode(Expression type, List<Expression> elts) {
        this.type = type;
        this.elts = NodeLists.copyOf(elts);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.COMPOSITE_LIT;
    }

    public Expression getType() {
        return type;
    }

    public void setType(Expression type) {
        this.type = type;
    }

    public List<Expression> getElts() {
        return elts;
    }

    public void setElts(List<Expression> elts) {
        this.elts = NodeLists.copyOf(elts);
    }
}
