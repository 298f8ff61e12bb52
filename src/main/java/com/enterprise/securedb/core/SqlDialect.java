package com.enterprise.securedb.core;

/**
 * Target database conventions the template engine and the data-access layer depend on:
 * the identifier quote pair and the pagination clause.
 */
public interface SqlDialect {

    /** Canonical dialect tag, e.g. {@code mysql}. */
    String name();

    char openQuote();

    char closeQuote();

    String limitOffset(int count, int skip);
}
