package com.pineparser;

/**
 * Raised when the nesting of the input exceeds the configured recursion limit.
 */
public class RecursionLimitExceededException extends ParseException {

    private final int limit;

    public RecursionLimitExceededException(int limit, Token token) {
        super("Maximum nesting depth of " + limit + " exceeded", token);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
