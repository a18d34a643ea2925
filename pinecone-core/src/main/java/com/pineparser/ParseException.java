package com.pineparser;

/**
 * Syntax error reported by the grammar. Line and column are 1-based and refer to the
 * comment-free buffer the grammar was given.
 */
public class ParseException extends RuntimeException {

    private final String reason;
    private final int line;
    private final int column;

    public ParseException(String reason, int line, int column) {
        super(reason + " (line " + line + ", column " + column + ")");
        this.reason = reason;
        this.line = line;
        this.column = column;
    }

    public ParseException(String reason, Token token) {
        this(reason, token.line(), token.column());
    }

    /**
     * The message without the location suffix.
     */
    public String getReason() {
        return reason;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
