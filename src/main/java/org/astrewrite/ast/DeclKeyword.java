package org.astrewrite.ast;

/**
 * The keyword introducing a {@link GenDeclNode}.
 */
public enum DeclKeyword {
    IMPORT,
    CONST,
    TYPE,
    VAR
}
