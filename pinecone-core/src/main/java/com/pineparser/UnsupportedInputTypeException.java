package com.pineparser;

public class UnsupportedInputTypeException extends IllegalArgumentException {

    public UnsupportedInputTypeException(Object input) {
        super("Unsupported argument type: " + (input == null ? "null" : input.getClass().getName()));
    }
}
