package com.pineparser.ast;

/**
 * 1-based position of the first character of a node in the comment-free source.
 */
public record SourceLocation(int line, int column) {

    public static final SourceLocation NONE = new SourceLocation(0, 0);

    public boolean isKnown() {
        return line > 0;
    }
}
