package com.enterprise.securedb.debug;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.Temporal;
import java.util.HexFormat;

/**
 * Renders bound values as SQL literals for diagnostic output.
 * Nothing produced here is ever sent to the database.
 */
public final class SqlLiteralFormatter {

    private SqlLiteralFormatter() {}

    public static String format(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof String s) {
            return quote(s);
        }
        if (value instanceof BigDecimal bd) {
            return bd.toPlainString();
        }
        if (value instanceof Number n) {
            return n.toString();
        }
        if (value instanceof Boolean b) {
            return b ? "1" : "0";
        }
        if (value instanceof LocalDate ld) {
            return "DATE '" + ld + "'";
        }
        if (value instanceof LocalDateTime ldt) {
            return "TIMESTAMP '" + ldt.toString().replace('T', ' ') + "'";
        }
        if (value instanceof Temporal t) {
            return quote(t.toString());
        }
        if (value instanceof byte[] bytes) {
            return "X'" + HexFormat.of().withUpperCase().formatHex(bytes) + "'";
        }
        return quote(value.toString());
    }

    private static String quote(String s) {
        return "'" + s.replace("'", "''") + "'";
    }
}
