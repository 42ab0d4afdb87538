package org.astrewrite.ast;

/**
 * Marker interface for nodes of the statement family.
 */
public interface Statement extends AstNode {
}
