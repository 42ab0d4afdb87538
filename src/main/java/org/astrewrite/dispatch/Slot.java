package org.astrewrite.dispatch;

import org.astrewrite.api.RewriteErrorCode;
import org.astrewrite.api.RewriteException;
import org.astrewrite.ast.AstNode;

import java.util.List;

/**
 * A named child position of a node kind.
 * <p>
 * Slots only describe and access children; deciding what a removal means for the owner is
 * left to the traversal that uses them.
 *
 * @param <N> The node class owning the slot.
 * @param <C> The node type the slot accepts.
 */
public abstract sealed class Slot<N extends AstNode, C extends AstNode> permits SingleSlot, ListSlot {

    private final String name;
    private final Class<N> ownerType;
    private final Class<C> childType;

    Slot(String name, Class<N> ownerType, Class<C> childType) {
        this.name = name;
        this.ownerType = ownerType;
        this.childType = childType;
    }

    public String name() {
        return name;
    }

    public Class<C> childType() {
        return childType;
    }

    public abstract Multiplicity multiplicity();

    /**
     * @return {@code true} if the slot holds a comment group attached to its owner rather than a structural child.
     */
    public boolean isAnnotation() {
        return false;
    }

    /**
     * Returns the non-{@code null} children currently held by this slot of {@code owner}, in order.
     *
     * @param owner The node owning the slot.
     * @return The children, possibly empty.
     */
    public abstract List<AstNode> children(AstNode owner);

    /**
     * Verifies that {@code candidate} may be stored in this slot.
     *
     * @param owner The node owning the slot, used for the error message.
     * @param candidate The node about to be stored.
     * @return The candidate, typed as the slot's child type.
     * @throws RewriteException with {@link RewriteErrorCode#KIND_MISMATCH} if the candidate does not fit.
     */
    public C accept(AstNode owner, AstNode candidate) {
        if (!childType.isInstance(candidate)) {
            throw new RewriteException(RewriteErrorCode.KIND_MISMATCH, String.format(
                    "Slot %s.%s expects %s but got %s (%s)",
                    owner.kind().displayName(), name, childType.getSimpleName(),
                    candidate.describe(), candidate.kind() != null ? candidate.kind().family() : "no kind"));
        }
        return childType.cast(candidate);
    }

    N owner(AstNode node) {
        return ownerType.cast(node);
    }

    @Override
    public String toString() {
        return ownerType.getSimpleName() + "." + name + " [" + multiplicity() + "]";
    }
}
