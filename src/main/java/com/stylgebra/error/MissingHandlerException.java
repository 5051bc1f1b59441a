package com.stylgebra.error;

public class MissingHandlerException extends StylgebraException {
    public MissingHandlerException(Class<?> nodeClass) {
        super("No rendering logic registered for node type " + nodeClass.getSimpleName());
    }
}
