package com.pineparser;

public class UnexpectedTokenException extends ParseException {

    public UnexpectedTokenException(Token token, String context) {
        super(message(token, context), token);
    }

    private static String message(Token token, String context) {
        if (token.type() == TokenType.ERROR) {
            return (String) token.literal();
        }
        return "Unexpected " + token.describe() + " in " + context;
    }
}
