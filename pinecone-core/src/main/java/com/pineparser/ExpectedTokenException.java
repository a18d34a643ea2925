package com.pineparser;

public class ExpectedTokenException extends ParseException {

    public ExpectedTokenException(String expected, Token found) {
        super(expected + ", found " + found.describe(), found);
    }
}
