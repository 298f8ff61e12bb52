package com.enterprise.securedb.param;

/**
 * Control values for {@code { ... }} macro blocks.
 *
 * <pre>{@code
 * db.select("SELECT * FROM users WHERE 1=1 { AND name = ? } { AND active = ? }",
 *         "John", MacroControl.SKIP);
 * }</pre>
 */
public enum MacroControl {

    /** Drops the enclosing macro block together with all of its parameters. */
    SKIP
}
