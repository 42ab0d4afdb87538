package org.astrewrite.rewrite;

import org.astrewrite.api.RewriteErrorCode;
import org.astrewrite.api.RewriteException;
import org.astrewrite.api.RewriteResult;
import org.astrewrite.ast.AstNode;
import org.astrewrite.config.RewriteOptions;
import org.astrewrite.dispatch.EmptyPolicy;
import org.astrewrite.dispatch.ListSlot;
import org.astrewrite.dispatch.Multiplicity;
import org.astrewrite.dispatch.SingleSlot;
import org.astrewrite.dispatch.Slot;
import org.astrewrite.dispatch.SlotTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Performs one depth-first rewrite of a tree.
 * <p>
 * For every node the visitor is entered first. Unless it removes the node or skips its children,
 * the slots of the retained node are processed in declared order:
 * <ul>
 *   <li>a required child that is removed removes the owner as well (cascade), the remaining
 *       slots are not processed;</li>
 *   <li>an optional child that is removed clears its slot;</li>
 *   <li>a collection is filtered by the {@link CollectionRewriter}; if the rewrite empties a
 *       {@link EmptyPolicy#REMOVAL_TRIGGERING} collection, the owner is removed as well.</li>
 * </ul>
 * Once all slots are processed without cascade, the visitor's {@link RewriteVisitor#leave} is called.
 * <p>
 * The tree is mutated in place. A walker owns the whole tree for the duration of its walk:
 * concurrent walks over the same tree or overlapping subtrees are not supported and are not
 * detected. A walker instance performs a single walk and is not thread-safe.
 */
public final class RewriteWalker {

    private static final Logger LOG = LoggerFactory.getLogger(RewriteWalker.class);

    private final RewriteVisitor visitor;
    private final RewriteOptions options;
    private final StatisticsCollector statistics = new StatisticsCollector();
    private final AnnotationPruner pruner = new AnnotationPruner(statistics);
    private final CollectionRewriter collections = new CollectionRewriter(this, pruner, statistics);
    private boolean used;

    /**
     * @param visitor The visitor driving the rewrite.
     * @param options The rewrite options.
     */
    public RewriteWalker(RewriteVisitor visitor, RewriteOptions options) {
        this.visitor = visitor;
        this.options = options;
    }

    /**
     * Rewrites the tree below {@code root}.
     *
     * @param root The root of the tree; if {@code null}, the visitor is not called.
     * @return The outcome, including the new root.
     * @throws RewriteException if the visitor or the tree violates the rewrite contract.
     * @throws IllegalStateException if this walker has already been used.
     */
    public RewriteResult run(AstNode root) {
        if (used) {
            throw new IllegalStateException("A RewriteWalker performs a single walk");
        }
        used = true;
        if (root == null) {
            return new RewriteResult(null, false, statistics.snapshot());
        }

        LOG.debug("Rewriting tree rooted at {}", root.describe());
        Rewritten outcome = walk(root, null, null);
        RewriteResult result;
        if (outcome.isRemoved()) {
            pruner.prune(outcome.discarded());
            result = new RewriteResult(null, true, statistics.snapshot());
        } else {
            if (options.compactFileComments()) {
                pruner.compactCommentIndexes(outcome.node());
            }
            result = new RewriteResult(outcome.node(), false, statistics.snapshot());
        }
        if (options.logSummary()) {
            LOG.debug("Rewrite finished{}: {}", result.removed() ? " (root removed)" : "", result.statistics());
        }
        return result;
    }

    /**
     * Walks {@code node}, which sits in {@code slot} of {@code owner}. The node the visitor keeps
     * is checked against the slot before any of its children are visited.
     *
     * @param node The node to walk.
     * @param owner The owner of the slot, {@code null} for the root.
     * @param slot The slot holding the node, {@code null} for the root.
     * @return The outcome for the node.
     */
    Rewritten walk(AstNode node, AstNode owner, Slot<?, ?> slot) {
        VisitResult decision = visitor.enter(node);
        if (decision == null) {
            throw new RewriteException(RewriteErrorCode.INVALID_VISIT_RESULT,
                    "Visitor returned no result for " + node.describe());
        }
        statistics.nodeEntered();

        if (decision.isRemoval()) {
            statistics.explicitRemoval();
            return Rewritten.removed(node);
        }
        AstNode current = decision.node();
        if (current != node) {
            statistics.replacement();
        }
        if (slot != null) {
            slot.accept(owner, current);
        }
        if (!decision.shouldDescend()) {
            return Rewritten.kept(current);
        }

        for (Slot<?, ?> childSlot : SlotTable.slotsOf(current)) {
            if (!rewriteSlot(current, childSlot)) {
                statistics.cascadeRemoval();
                LOG.trace("{} removed: slot '{}' ({}) lost its content", current.describe(), childSlot.name(), childSlot.multiplicity());
                return Rewritten.removed(current);
            }
        }

        visitor.leave(current);
        return Rewritten.kept(current);
    }

    /**
     * @return {@code false} if the owner must be removed.
     */
    private boolean rewriteSlot(AstNode owner, Slot<?, ?> slot) {
        return switch (slot.multiplicity()) {
            case REQUIRED, OPTIONAL -> rewriteSingle(owner, (SingleSlot<?, ?>) slot);
            case COLLECTION -> rewriteCollection(owner, (ListSlot<?, ?>) slot);
        };
    }

    private boolean rewriteSingle(AstNode owner, SingleSlot<?, ?> slot) {
        AstNode child = slot.get(owner);
        if (child == null) {
            return true;
        }
        Rewritten outcome = walk(child, owner, slot);
        if (outcome.isRemoved()) {
            pruner.prune(outcome.discarded());
            if (slot.multiplicity() == Multiplicity.REQUIRED) {
                return false;
            }
            slot.set(owner, null);
            return true;
        }
        slot.set(owner, outcome.node());
        return true;
    }

    private boolean rewriteCollection(AstNode owner, ListSlot<?, ?> slot) {
        if (slot.get(owner).isEmpty()) {
            return true;
        }
        // Absent elements are dropped but do not count as content the walk could remove.
        boolean hadElements = !slot.children(owner).isEmpty();
        List<AstNode> survivors = collections.rewrite(owner, slot);
        slot.set(owner, survivors);
        return !hadElements || !survivors.isEmpty() || slot.emptyPolicy() == EmptyPolicy.REMOVAL_TOLERANT;
    }
}
