package com.pineparser;

/**
 * A lexical token. {@code literal} holds the decoded value of number and string tokens,
 * and the error message of {@link TokenType#ERROR} tokens.
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int line,
    int column
) {
    public Token(TokenType type, String lexeme, int line, int column) {
        this(type, lexeme, null, line, column);
    }

    /**
     * Short form used in error messages.
     */
    public String describe() {
        return switch (type) {
            case NEWLINE -> "end of line";
            case INDENT -> "indent";
            case DEDENT -> "dedent";
            case EOF -> "end of text";
            default -> "'" + lexeme + "'";
        };
    }
}
