package com.enterprise.securedb.db;

/**
 * Receives one entry before each statement runs, one after it completes, and one when
 * it fails.
 */
@FunctionalInterface
public interface QueryLogger {

    void log(QueryLogEntry entry);
}
