package org.astrewrite.ast;

/**
 * The lexical kind of a {@link BasicLiteralNode}.
 */
public enum LiteralKind {
    INT,
    FLOAT,
    IMAG,
    CHAR,
    STRING
}
