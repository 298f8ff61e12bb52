package com.enterprise.securedb.exception;

/**
 * More parameters were supplied than the macro-filtered template consumes.
 */
public class ParameterCountException extends TemplateException {

    public ParameterCountException(int expected, int actual) {
        super("Parameter count (" + actual + ") != placeholder count (" + expected + ")");
    }
}
