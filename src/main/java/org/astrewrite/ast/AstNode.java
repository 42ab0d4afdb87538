package org.astrewrite.ast;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Every node carries a {@link NodeKind} drawn from a closed enumeration. The child
 * positions ("slots") of each kind are not exposed here but are described by the
 * rewrite engine's slot table, so that traversals never need to know the concrete
 * node classes.
 * <p>
 * Nodes are mutable and own their children exclusively: a node instance must appear
 * in at most one slot of one tree.
 */
public interface AstNode {

    /**
     * Returns the kind tag of this node.
     *
     * @return The kind of this node, never {@code null} for nodes of the built-in taxonomy.
     */
    NodeKind kind();

    /**
     * Returns a short, single-line description of this node: its kind and its
     * non-structural attributes (names, literal values, operators). Children are not included.
     *
     * @return A human-readable description of the node.
     */
    default String describe() {
        NodeKind kind = kind();
        return kind != null ? kind.displayName() : getClass().getSimpleName();
    }
}
