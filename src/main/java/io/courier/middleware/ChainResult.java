package io.courier.middleware;

public enum ChainResult {
    /** The terminal ran. */
    COMPLETED,
    /** A step halted the chain and left an outcome on the context. */
    SHORT_CIRCUITED,
    /** A step halted the chain without an outcome; the caller must supply one. */
    FELL_THROUGH
}
