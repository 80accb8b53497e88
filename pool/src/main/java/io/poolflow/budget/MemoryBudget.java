package io.poolflow.budget;

/**
 * Enforcing accountant with a fixed byte capacity.
 */
public class MemoryBudget implements ResourceAccountant {
    private final long capacity;
    private long allocated;

    public MemoryBudget(long capacityBytes) {
        if (capacityBytes < 0) throw new IllegalArgumentException("capacity must be >= 0: " + capacityBytes);
        this.capacity = capacityBytes;
    }

    @Override
    public synchronized boolean reserve(long cost) {
        if (cost < 0) throw new IllegalArgumentException("cost must be >= 0: " + cost);
        // capacity - allocated never overflows; allocated + cost could
        if (cost > capacity - allocated) return false;
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
    public long capacity() { return capacity; }

    @Override
    public synchronized long allocated() { return allocated; }

    @Override
    public synchronized long available() { return capacity - allocated; }

    @Override
    public boolean bounded() { return true; }

    @Override
    public String toString() {
        return "MemoryBudget{capacity=" + capacity + ", allocated=" + allocated() + '}';
    }
}
