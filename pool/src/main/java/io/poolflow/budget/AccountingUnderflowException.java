package io.poolflow.budget;

/**
 * A release larger than the outstanding allocation. Indicates a double release or a mis-tracked
 * cost; the owning pool cannot continue once its books are wrong.
 */
public class AccountingUnderflowException extends IllegalStateException {
    private final long allocated;
    private final long requested;

    public AccountingUnderflowException(long allocated, long requested) {
        super("release of " + requested + " bytes exceeds allocated " + allocated + " bytes");
        this.allocated = allocated;
        this.requested = requested;
    }

    public long allocated() { return allocated; }
    public long requested() { return requested; }
}
