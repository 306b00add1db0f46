package com.libragraph.unwrap.util.buffer;

/**
 * Thrown when a {@link ByteBudget} would be overdrawn.
 */
public class BudgetExceededException extends RuntimeException {

    private final long limit;
    private final long attempted;

    public BudgetExceededException(String scope, long limit, long attempted) {
        super("Expanded bytes for " + scope + " would reach " + attempted + ", limit is " + limit);
        this.limit = limit;
        this.attempted = attempted;
    }

    public long limit() {
        return limit;
    }

    public long attempted() {
        return attempted;
    }
}
