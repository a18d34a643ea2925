package com.pineparser;

public enum TokenType {
    // Literals and names
    IDENTIFIER,
    INT,
    FLOAT,
    STRING,
    COLOR,

    // Keywords
    AND,
    OR,
    NOT,
    IF,
    ELSE,
    FOR,
    TO,
    BY,
    IN,
    WHILE,
    SWITCH,
    VAR,
    VARIP,
    IMPORT,
    AS,
    TRUE,
    FALSE,
    BREAK,
    CONTINUE,

    // Operators and punctuation
    PLUS,
    MINUS,
    STAR,
    SLASH,
    PERCENT,
    ASSIGN,          // =
    COLON_ASSIGN,    // :=
    PLUS_ASSIGN,
    MINUS_ASSIGN,
    STAR_ASSIGN,
    SLASH_ASSIGN,
    PERCENT_ASSIGN,
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE,
    QUESTION,
    COLON,
    ARROW,           // =>
    DOT,
    COMMA,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,

    // Layout
    NEWLINE,
    INDENT,
    DEDENT,

    ERROR,
    EOF
}
