package com.stylgebra.error;

/**
 * Signals a feature gap rather than a bug: the requested capability exists in principle
 * but has not been implemented for this kind of structure.
 */
public class NotYetSupportedException extends StylgebraException {
    public NotYetSupportedException(String message) {
        super(message);
    }
}
