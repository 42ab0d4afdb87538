package org.astrewrite.ast;

/**
 * Marker interface for type nodes (array, struct, function, interface, map and channel types).
 * Types are expressions, so they may occupy any expression slot.
 */
public interface TypeExpression extends Expression {
}
