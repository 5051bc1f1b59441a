package com.stylgebra.error;

/**
 * Base class for every failure raised while building or rendering expression trees.
 * All of them abort the render call that raised them.
 */
public class StylgebraException extends RuntimeException {
    public StylgebraException(String message) {
        super(message);
    }

    public StylgebraException(String message, Throwable cause) {
        super(message, cause);
    }
}
