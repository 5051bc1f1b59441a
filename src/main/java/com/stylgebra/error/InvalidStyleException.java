package com.stylgebra.error;

public class InvalidStyleException extends StylgebraException {
    public InvalidStyleException(String option, Object value) {
        super("Invalid value for style option '" + option + "': " + value);
    }
}
