package io.poolflow.budget;

/**
 * ResourceAccountant governs the memory budget shared by all running jobs of a pool.
 * Amounts are bytes. Implementations are owned by exactly one pool.
 */
public interface ResourceAccountant {
    /** Reserve {@code cost} bytes. Returns true and records the allocation iff it fits; otherwise changes nothing. */
    boolean reserve(long cost);

    /** Give back {@code cost} bytes previously reserved. */
    void release(long cost);

    /** Total budget; {@link Long#MAX_VALUE} when unbounded. */
    long capacity();

    long allocated();

    default long available() { return capacity() - allocated(); }

    /** False when the platform could not provide a limit and admission is unconstrained. */
    boolean bounded();
}
