package org.astrewrite.api;

/**
 * Defines unique, testable error codes for the fatal conditions that abort a rewrite.
 * Each of them signals a defect in the calling visitor or in the node taxonomy, never a
 * problem with the tree data itself.
 */
public enum RewriteErrorCode {
    /** A visitor returned a replacement that does not fit the slot it is assigned into. */
    KIND_MISMATCH,
    /** A node carries a kind that the slot table does not know, or a kind that does not match its class. */
    UNKNOWN_KIND,
    /** A visitor returned no result at all, or asked to keep an absent node. */
    INVALID_VISIT_RESULT
}
