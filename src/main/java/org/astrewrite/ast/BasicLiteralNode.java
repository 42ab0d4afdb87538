package org.astrewrite.ast;

/**
 * A literal of basic type.
 *
 * The value is kept in its source form, e.g. {@code 42}, {@code 0x7f}, {@code 'a'} or {@code "foo"}.
 */
public class BasicLiteralNode extends AbstractNode implements Expression {

    private final LiteralKind literalKind;
    private String value;

    public BasicLiteralNode(LiteralKind literalKind, String value) {
        this.literalKind = literalKind;
        this.value = value;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BASIC_LIT;
    }

    public LiteralKind getLiteralKind() {
        return literalKind;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    @Override
    public String describe() {
        return "BasicLit(literalKind=" + literalKind + ", value=" + value + ")";
    }
}
