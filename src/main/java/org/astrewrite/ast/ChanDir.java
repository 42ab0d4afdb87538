package org.astrewrite.ast;

/**
 * Direction of a channel type.
 */
public enum ChanDir {
    /** Bidirectional channel ({@code chan T}). */
    BOTH,
    /** Send-only channel ({@code chan<- T}). */
    SEND,
    /** Receive-only channel ({@code <-chan T}). */
    RECV
}
