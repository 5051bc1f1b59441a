package com.stylgebra.error;

/**
 * A lookup node indexed past the end of its backing table.
 */
public class LookupIndexException extends StylgebraException {
    public LookupIndexException(Object index, Object table) {
        super("Index " + index + " not in lookup: " + table);
    }
}
