package com.enterprise.securedb.exception;

/**
 * A query template could not be rendered. Always fatal to the current call.
 */
public class TemplateException extends SecureDbException {

    public TemplateException(String message) {
        super(message);
    }
}
