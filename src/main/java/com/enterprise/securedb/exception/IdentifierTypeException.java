package com.enterprise.securedb.exception;

public class IdentifierTypeException extends TemplateException {

    public IdentifierTypeException(Object actual) {
        super("Identifier placeholder ?# requires a string parameter, got "
                + (actual == null ? "null" : actual.getClass().getName()));
    }
}
