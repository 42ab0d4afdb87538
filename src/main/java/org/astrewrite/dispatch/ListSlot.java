package org.astrewrite.dispatch;

import org.astrewrite.ast.AstNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * An ordered collection slot.
 */
public final class ListSlot<N extends AstNode, C extends AstNode> extends Slot<N, C> {

    private final EmptyPolicy emptyPolicy;
    private final Function<N, List<C>> getter;
    private final BiConsumer<N, List<C>> setter;

    private ListSlot(String name, Class<N> ownerType, Class<C> childType, EmptyPolicy emptyPolicy,
                     Function<N, List<C>> getter, BiConsumer<N, List<C>> setter) {
        super(name, ownerType, childType);
        this.emptyPolicy = emptyPolicy;
        this.getter = getter;
        this.setter = setter;
    }

    /**
     * Creates a collection slot whose owner is removed when a rewrite empties it.
     */
    public static <N extends AstNode, C extends AstNode> ListSlot<N, C> triggering(
            String name, Class<N> ownerType, Class<C> childType, Function<N, List<C>> getter, BiConsumer<N, List<C>> setter) {
        return new ListSlot<>(name, ownerType, childType, EmptyPolicy.REMOVAL_TRIGGERING, getter, setter);
    }

    /**
     * Creates a collection slot that may legally end up empty.
     */
    public static <N extends AstNode, C extends AstNode> ListSlot<N, C> tolerant(
            String name, Class<N> ownerType, Class<C> childType, Function<N, List<C>> getter, BiConsumer<N, List<C>> setter) {
        return new ListSlot<>(name, ownerType, childType, EmptyPolicy.REMOVAL_TOLERANT, getter, setter);
    }

    @Override
    public Multiplicity multiplicity() {
        return Multiplicity.COLLECTION;
    }

    public EmptyPolicy emptyPolicy() {
        return emptyPolicy;
    }

    /**
     * @param owner The node owning the slot.
     * @return The elements as stored on the owner; an empty list if the owner holds none.
     */
    public List<C> get(AstNode owner) {
        List<C> elements = getter.apply(owner(owner));
        return elements == null ? Collections.emptyList() : elements;
    }

    /**
     * Replaces the elements of this slot of {@code owner}.
     *
     * @throws org.astrewrite.api.RewriteException if an element does not fit the slot.
     */
    public void set(AstNode owner, List<? extends AstNode> elements) {
        List<C> typed = new ArrayList<>(elements.size());
        for (AstNode element : elements) {
            typed.add(accept(owner, element));
        }
        setter.accept(owner(owner), typed);
    }

    @Override
    public List<AstNode> children(AstNode owner) {
        List<AstNode> children = new ArrayList<>();
        for (C element : get(owner)) {
            if (element != null) {
                children.add(element);
            }
        }
        return children;
    }
}
