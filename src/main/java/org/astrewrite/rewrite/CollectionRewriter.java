package org.astrewrite.rewrite;

import org.astrewrite.ast.AstNode;
import org.astrewrite.dispatch.ListSlot;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites the elements of an ordered collection slot.
 * <p>
 * Every element is walked in order; survivors are collected into a fresh list in their original
 * relative order. Elements that are removed, explicitly or by cascade, are handed to the
 * {@link AnnotationPruner} before they are dropped. Absent elements are dropped silently.
 */
final class CollectionRewriter {

    private final RewriteWalker walker;
    private final AnnotationPruner pruner;
    private final StatisticsCollector statistics;

    CollectionRewriter(RewriteWalker walker, AnnotationPruner pruner, StatisticsCollector statistics) {
        this.walker = walker;
        this.pruner = pruner;
        this.statistics = statistics;
    }

    /**
     * @param owner The node owning the collection.
     * @param slot The collection slot.
     * @return The surviving elements, in order. The owner's slot is not modified.
     * @throws org.astrewrite.api.RewriteException if a replacement does not fit the slot.
     */
    List<AstNode> rewrite(AstNode owner, ListSlot<?, ?> slot) {
        List<? extends AstNode> elements = slot.get(owner);
        List<AstNode> survivors = new ArrayList<>(elements.size());
        for (AstNode element : elements) {
            if (element == null) {
                continue;
            }
            Rewritten outcome = walker.walk(element, owner, slot);
            if (outcome.isRemoved()) {
                pruner.prune(outcome.discarded());
                statistics.elementDropped();
                continue;
            }
            survivors.add(slot.accept(owner, outcome.node()));
        }
        return survivors;
    }
}
