package com.enterprise.securedb.db;

import org.springframework.dao.DataAccessException;

import java.util.List;

/**
 * Notified when the database rejects a statement, before the failure is rethrown as a
 * {@link com.enterprise.securedb.exception.SecureDbException}.
 */
@FunctionalInterface
public interface ErrorHandler {

    /**
     * @param error  the driver failure, translated by Spring
     * @param query  the template as passed by the caller
     * @param params the caller's raw parameters
     */
    void onError(DataAccessException error, String query, List<Object> params);
}
