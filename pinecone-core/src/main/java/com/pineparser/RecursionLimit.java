package com.pineparser;

/**
 * Nesting budget for one grammar run. Every recursive rule calls {@link #enter(Token)}
 * on the way in and {@link #exit()} in a finally block on the way out.
 *
 * <p>The budget belongs to a single {@link Parser}; there is no shared ceiling, so
 * parses on different threads never affect one another.</p>
 */
public final class RecursionLimit {

    public static final int DEFAULT_LIMIT = 1000;

    private final int limit;
    private int depth;

    public RecursionLimit(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("recursion limit must be at least 1, got " + limit);
        }
        this.limit = limit;
    }

    public void enter(Token token) {
        if (depth >= limit) {
            throw new RecursionLimitExceededException(limit, token);
        }
        depth++;
    }

    public void exit() {
        if (depth > 0) {
            depth--;
        }
    }

    public int depth() {
        return depth;
    }

    public int limit() {
        return limit;
    }
}
