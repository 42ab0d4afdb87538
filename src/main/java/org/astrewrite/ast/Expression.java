package org.astrewrite.ast;

/**
 * Marker interface for nodes of the expression family. Slots that expect an
 * expression accept any implementation, including {@link TypeExpression}s.
 */
public interface Expression extends AstNode {
}
