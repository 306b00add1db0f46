package com.libragraph.unwrap.util.buffer;

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Counts bytes materialized while decoding and refuses to go past a limit.
 *
 * <p>Budgets nest: a per-input budget created with {@link #child(String, long)} also
 * charges its parent, so one run-wide cap can sit above several per-input caps.
 * Safe to charge from several threads.
 */
public final class ByteBudget {

    public static final long UNLIMITED = Long.MAX_VALUE;

    private final String scope;
    private final long limit;
    private final ByteBudget parent;
    private final AtomicLong used = new AtomicLong();

    private ByteBudget(String scope, long limit, ByteBudget parent) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Budget limit must be positive, got: " + limit);
        }
        this.scope = scope;
        this.limit = limit;
        this.parent = parent;
    }

    public static ByteBudget unlimited() {
        return new ByteBudget("run", UNLIMITED, null);
    }

    public static ByteBudget of(String scope, long limit) {
        return new ByteBudget(scope, limit, null);
    }

    public ByteBudget child(String scope, long limit) {
        return new ByteBudget(scope, limit, this);
    }

    public long used() {
        return used.get();
    }

    public long limit() {
        return limit;
    }

    /**
     * Records {@code bytes} more expanded output.
     *
     * @throws BudgetExceededException if this budget or an ancestor is exhausted
     */
    public void charge(long bytes) {
        long total = used.addAndGet(bytes);
        if (total > limit) {
            throw new BudgetExceededException(scope, limit, total);
        }
        if (parent != null) {
            parent.charge(bytes);
        }
    }

    /**
     * Wraps {@code out} so that every byte written is charged first.
     */
    public OutputStream guard(OutputStream out) {
        return new FilterOutputStream(out) {
            @Override
            public void write(int b) throws IOException {
                charge(1);
                out.write(b);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                charge(len);
                out.write(b, off, len);
            }
        };
    }
}
