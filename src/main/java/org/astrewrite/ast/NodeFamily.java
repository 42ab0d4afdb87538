package org.astrewrite.ast;

/**
 * Groups the node kinds into families. Slot compatibility is decided on the
 * Java type expected by a slot; the family is used for diagnostics.
 */
public enum NodeFamily {
    /** Comments and comment groups. */
    COMMENT,
    /** Fields and field lists (parameters, results, struct fields, interface methods). */
    FIELD,
    /** Expressions. */
    EXPRESSION,
    /** Type expressions. */
    TYPE,
    /** Statements. */
    STATEMENT,
    /** Entries of a generic declaration. */
    SPECIFICATION,
    /** Declarations. */
    DECLARATION,
    /** Source files and packages. */
    FILE
}
