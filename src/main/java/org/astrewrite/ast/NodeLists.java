package org.astrewrite.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for the ordered child collections held by nodes.
 */
final class NodeLists {

    private NodeLists() {}

    /**
     * Copies the given list into a fresh, mutable list. A {@code null} list yields an empty one.
     */
    static <T> List<T> copyOf(List<? extends T> source) {
        return source == null ? new ArrayList<>() : new ArrayList<>(source);
    }
}
