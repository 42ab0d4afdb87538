package org.astrewrite.ast;

/**
 * Marker interface for top-level declarations.
 */
public interface Declaration extends AstNode {
}
