package io.poolflow.budget;

/**
 * Fallback used when the host cannot report a memory limit. Reservations succeed unless the exact
 * running total would no longer fit in a long, in which case the job waits like any job that does
 * not fit. Allocations are tracked so releases can be checked.
 */
public class UnboundedAccountant implements ResourceAccountant {
    private long allocated;

    @Override
    public synchronized boolean reserve(long cost) {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0: " + cost);
        if (cost > Long.MAX_VALUE - allocated) return false;
        allocated += cost;
        return true;
    }

    @Override
    public synchronized void release(long cost) {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0: " + cost);
        if (cost > allocated) throw new AccountingUnderflowException(allocated, cost);
        allocated -= cost;
    }

    @Override
    public long capacity() { return Long.MAX_VALUE; }

    @Override
    public synchronized long allocated() { return allocated; }

    @Override
    public boolean bounded() { return false; }

    @Override
    public String toString() {
        return "UnboundedAccountant{allocated=" + allocated() + '}';
    }
}
