package org.astrewrite.dispatch;

import org.astrewrite.ast.AstNode;
import org.astrewrite.ast.CommentGroupNode;

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * A slot holding at most one child, either {@link Multiplicity#REQUIRED} or {@link Multiplicity#OPTIONAL}.
 */
public final class SingleSlot<N extends AstNode, C extends AstNode> extends Slot<N, C> {

    private final Multiplicity multiplicity;
    private final boolean annotation;
    private final Function<N, C> getter;
    private final BiConsumer<N, C> setter;

    private SingleSlot(String name, Class<N> ownerType, Class<C> childType, Multiplicity multiplicity,
                       boolean annotation, Function<N, C> getter, BiConsumer<N, C> setter) {
        super(name, ownerType, childType);
        this.multiplicity = multiplicity;
        this.annotation = annotation;
        this.getter = getter;
        this.setter = setter;
    }

    public static <N extends AstNode, C extends AstNode> SingleSlot<N, C> required(
            String name, Class<N> ownerType, Class<C> childType, Function<N, C> getter, BiConsumer<N, C> setter) {
        return new SingleSlot<>(name, ownerType, childType, Multiplicity.REQUIRED, false, getter, setter);
    }

    public static <N extends AstNode, C extends AstNode> SingleSlot<N, C> optional(
            String name, Class<N> ownerType, Class<C> childType, Function<N, C> getter, BiConsumer<N, C> setter) {
        return new SingleSlot<>(name, ownerType, childType, Multiplicity.OPTIONAL, false, getter, setter);
    }

    /**
     * Creates an optional slot for a comment group attached to its owner (leading documentation
     * or trailing comment).
     */
    public static <N extends AstNode> SingleSlot<N, CommentGroupNode> annotation(
            String name, Class<N> ownerType, Function<N, CommentGroupNode> getter, BiConsumer<N, CommentGroupNode> setter) {
        return new SingleSlot<>(name, ownerType, CommentGroupNode.class, Multiplicity.OPTIONAL, true, getter, setter);
    }

    @Override
    public Multiplicity multiplicity() {
        return multiplicity;
    }

    @Override
    public boolean isAnnotation() {
        return annotation;
    }

    /**
     * @param owner The node owning the slot.
     * @return The child, or {@code null} if the slot is empty.
     */
    public C get(AstNode owner) {
        return getter.apply(owner(owner));
    }

    /**
     * Stores {@code child} in this slot of {@code owner}, or clears the slot if {@code child} is {@code null}.
     *
     * @throws org.astrewrite.api.RewriteException if the child does not fit the slot.
     */
    public void set(AstNode owner, AstNode child) {
        setter.accept(owner(owner), child == null ? null : accept(owner, child));
    }

    @Override
    public List<AstNode> children(AstNode owner) {
        C child = get(owner);
        return child == null ? List.of() : List.of(child);
    }
}
