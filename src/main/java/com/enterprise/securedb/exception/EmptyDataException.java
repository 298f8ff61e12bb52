package com.enterprise.securedb.exception;

/**
 * A CRUD helper was called with an empty column map or an empty WHERE map.
 */
public class EmptyDataException extends SecureDbException {

    public EmptyDataException(String message) {
        super(message);
    }
}
