package com.enterprise.securedb.exception;

/**
 * Root of every failure raised by the template engine and the data-access layer.
 */
public class SecureDbException extends RuntimeException {

    public SecureDbException(String message) {
        super(message);
    }

    public SecureDbException(String message, Throwable cause) {
        super(message, cause);
    }
}
