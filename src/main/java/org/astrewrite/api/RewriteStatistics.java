package org.astrewrite.api;

/**
 * Counters collected during one rewrite.
 *
 * @param nodesEntered Number of pre-order visitor calls.
 * @param replacements Number of nodes the visitor replaced by a different node.
 * @param explicitRemovals Number of nodes the visitor asked to remove.
 * @param cascadeRemovals Number of nodes removed because a required child or a removal-triggering collection was lost.
 * @param elementsDropped Number of elements filtered out of ordered collections.
 * @param commentsPruned Number of comments detached from discarded subtrees.
 */
public record RewriteStatistics(
        long nodesEntered,
        long replacements,
        long explicitRemovals,
        long cascadeRemovals,
        long elementsDropped,
        long commentsPruned
) {
    @Override
    public String toString() {
        return String.format("entered=%d, replaced=%d, removed=%d, cascaded=%d, dropped=%d, commentsPruned=%d",
                nodesEntered, replacements, explicitRemovals, cascadeRemovals, elementsDropped, commentsPruned);
    }
}
