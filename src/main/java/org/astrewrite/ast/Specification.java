package org.astrewrite.ast;

/**
 * Marker interface for the entries of a generic declaration (imports, constants/variables, types).
 */
public interface Specification extends AstNode {
}
