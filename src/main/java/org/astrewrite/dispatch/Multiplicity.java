package org.astrewrite.dispatch;

/**
 * How many children a slot holds.
 */
public enum Multiplicity {
    /** One child where present. Losing a child that was present removes the owner. */
    REQUIRED,
    /** Zero or one child. Losing it clears the slot. */
    OPTIONAL,
    /** Zero or more children in a significant order. */
    COLLECTION
}
