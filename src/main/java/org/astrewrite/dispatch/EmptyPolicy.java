package org.astrewrite.dispatch;

/**
 * What happens to the owner of a collection slot when a rewrite drops every element of it.
 * <p>
 * A collection that was already empty before the rewrite never affects its owner; the policy
 * only applies when the rewrite itself emptied the collection.
 */
public enum EmptyPolicy {
    /** The owner is meaningless without elements and is removed as well. */
    REMOVAL_TRIGGERING,
    /** The owner stays valid with an empty collection. */
    REMOVAL_TOLERANT
}
