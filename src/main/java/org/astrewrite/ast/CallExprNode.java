package org.astrewrite.ast;

import java.util.List;

/**
 * An expression followed by an argument list.
 */
public class CallExprNode extends AbstractNode implements Expression {

    private final boolean variadic;
    private Expression fun;
    private List<Expression> args;

    /**
     * Creates a call without a trailing {@code ...} on the last argument.
     */
    public CallExprNode(Expression fun, List<Expression> args) {
        this(false, fun, args);
    }

    public CallExprNode(boolean variadic, Expression fun, List<Expression> args) {
        this.variadic = variadic;
        this.fun = fun;
        this.args = NodeLists.copyOf(args);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CALL_EXPR;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public Expression getFun() {
        return fun;
    }

    public void setFun(Expression fun) {
        this.fun = fun;
    }

    public List<Expression> getArgs() {
        return args;
    }

    public void setArgs(List<Expression> args) {
        this.args = NodeLists.copyOf(args);
    }

    @Override
    public String describe() {
        return "CallExpr(variadic=" + variadic + ")";
    }
}
